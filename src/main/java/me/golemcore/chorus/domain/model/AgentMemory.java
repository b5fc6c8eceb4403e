package me.golemcore.chorus.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Long-term memory entry owned by an agent.
 *
 * <p>
 * Type changes only journal to core, and the constitutional flag can only be
 * set. Both rules are enforced here instead of through plain setters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMemory {

    private Long id;
    private String agentId;
    private MemoryType memoryType;
    private boolean constitutional;
    private String content;
    private int tokenEstimate;
    private Instant createdAt;
    private boolean discarded;

    public boolean isCore() {
        return memoryType == MemoryType.CORE;
    }

    public boolean isJournal() {
        return memoryType == MemoryType.JOURNAL;
    }

    /**
     * Journal entries older than the window are expired; core entries never are.
     */
    public boolean isExpired(Instant now, Duration journalWindow) {
        if (!isJournal()) {
            return false;
        }
        return createdAt == null || createdAt.isBefore(now.minus(journalWindow));
    }

    public boolean isLive(Instant now, Duration journalWindow) {
        return !discarded && !isExpired(now, journalWindow);
    }

    public void promoteToCore() {
        this.memoryType = MemoryType.CORE;
    }

    public void markConstitutional() {
        this.constitutional = true;
    }

    public void setMemoryType(MemoryType memoryType) {
        if (this.memoryType == MemoryType.CORE && memoryType != MemoryType.CORE) {
            throw new IllegalStateException("Core memory " + id + " cannot be demoted");
        }
        this.memoryType = memoryType;
    }

    public void setConstitutional(boolean constitutional) {
        if (this.constitutional && !constitutional) {
            throw new IllegalStateException("Constitutional flag on memory " + id + " is permanent");
        }
        this.constitutional = constitutional;
    }
}
