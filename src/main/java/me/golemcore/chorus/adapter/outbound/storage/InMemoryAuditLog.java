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

import me.golemcore.chorus.domain.model.AuditEntry;
import me.golemcore.chorus.port.outbound.AuditPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail kept in memory.
 */
@Component
@Slf4j
public class InMemoryAuditLog implements AuditPort {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEntry entry) {
        entries.add(entry);
        log.debug("[Audit] {} agent={} {}", entry.action(), entry.agentId(), entry.payload());
    }

    @Override
    public List<AuditEntry> findByAgent(String agentId) {
        return entries.stream()
                .filter(entry -> Objects.equals(entry.agentId(), agentId))
                .toList();
    }

    @Override
    public boolean existsForAccountSince(String accountId, Instant since) {
        return entries.stream()
                .filter(entry -> Objects.equals(entry.accountId(), accountId))
                .anyMatch(entry -> entry.createdAt() != null && !entry.createdAt().isBefore(since));
    }
}
