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

import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local agent store.
 */
@Component
public class InMemoryAgentRepository implements AgentRepositoryPort {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();

    @Override
    public Optional<Agent> findById(String agentId) {
        return agentId != null ? Optional.ofNullable(agents.get(agentId)) : Optional.empty();
    }

    @Override
    public List<Agent> findActive() {
        return agents.values().stream()
                .filter(Agent::isActive)
                .sorted(Comparator.comparing(Agent::getId))
                .toList();
    }

    @Override
    public Agent save(Agent agent) {
        if (agent.getId() == null) {
            agent.setId(UUID.randomUUID().toString());
        }
        agents.put(agent.getId(), agent);
        return agent;
    }
}
