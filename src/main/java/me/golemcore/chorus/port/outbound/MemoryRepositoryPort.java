package me.golemcore.chorus.port.outbound;

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

import java.util.List;
import java.util.Optional;

/**
 * Per-agent memory store. Discarded entries are excluded from every finder.
 */
public interface MemoryRepositoryPort {

    AgentMemory create(AgentMemory memory);

    AgentMemory update(AgentMemory memory);

    Optional<AgentMemory> findById(Long memoryId);

    List<AgentMemory> findByAgent(String agentId);
}
