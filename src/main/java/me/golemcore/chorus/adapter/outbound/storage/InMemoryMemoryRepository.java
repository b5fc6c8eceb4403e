package me.golemcore.chorus.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local agent memory store. Discarded entries stay stored but are not
 * listed.
 */
@Component
public class InMemoryMemoryRepository implements MemoryRepositoryPort {

    private final Map<Long, AgentMemory> memories = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public AgentMemory create(AgentMemory memory) {
        memory.setId(sequence.incrementAndGet());
        memories.put(memory.getId(), memory);
        return memory;
    }

    @Override
    public AgentMemory update(AgentMemory memory) {
        if (memory.getId() == null || !memories.containsKey(memory.getId())) {
            throw new IllegalArgumentException("Memory not found: " + memory.getId());
        }
        memories.put(memory.getId(), memory);
        return memory;
    }

    @Override
    public Optional<AgentMemory> findById(Long memoryId) {
        return memoryId != null ? Optional.ofNullable(memories.get(memoryId)) : Optional.empty();
    }

    @Override
    public List<AgentMemory> findByAgent(String agentId) {
        return memories.values().stream()
                .filter(memory -> Objects.equals(memory.getAgentId(), agentId))
                .filter(memory -> !memory.isDiscarded())
                .sorted(Comparator.comparing(AgentMemory::getId))
                .toList();
    }
}
