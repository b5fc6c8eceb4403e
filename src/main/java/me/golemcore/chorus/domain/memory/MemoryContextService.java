package me.golemcore.chorus.domain.memory;

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

import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

/**
 * Read side of agent memory. Expired journal entries and discarded entries are
 * filtered out of every view.
 */
@Service
@RequiredArgsConstructor
public class MemoryContextService {

    static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);

    private final MemoryRepositoryPort memoryRepository;
    private final ChorusProperties properties;
    private final Clock clock;

    public List<AgentMemory> coreMemories(String agentId) {
        return memoryRepository.findByAgent(agentId).stream()
                .filter(memory -> !memory.isDiscarded())
                .filter(AgentMemory::isCore)
                .sorted(Comparator.comparing(AgentMemory::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    public List<AgentMemory> liveJournal(String agentId) {
        Instant now = clock.instant();
        return memoryRepository.findByAgent(agentId).stream()
                .filter(AgentMemory::isJournal)
                .filter(memory -> memory.isLive(now, properties.getMemory().getJournalWindow()))
                .sorted(Comparator.comparing(AgentMemory::getCreatedAt))
                .toList();
    }

    public int coreTokenUsage(String agentId) {
        return coreMemories(agentId).stream().mapToInt(AgentMemory::getTokenEstimate).sum();
    }

    /**
     * Memory section of an agent's system prompt.
     */
    public String render(Agent agent) {
        List<AgentMemory> core = coreMemories(agent.getId());
        List<AgentMemory> journal = liveJournal(agent.getId());
        if (core.isEmpty() && journal.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("# Your Private Memory\n");
        if (!core.isEmpty()) {
            sb.append("\n## Core Memories (permanent)\n");
            core.forEach(memory -> sb.append("- ").append(memory.getContent()).append('\n'));
        }
        if (!journal.isEmpty()) {
            sb.append("\n## Recent Journal\n");
            journal.forEach(memory -> sb.append("- [").append(DAY_FORMAT.format(memory.getCreatedAt()))
                    .append("] ").append(memory.getContent()).append('\n'));
        }
        return sb.toString();
    }
}
