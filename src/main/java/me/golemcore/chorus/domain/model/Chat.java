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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A shared conversation thread between humans and one or more agents.
 *
 * <p>
 * Chats in manual-response mode are the multi-agent group chats: agents only
 * speak when explicitly scheduled (by a human or by the sequencer). The
 * consolidation watermark makes memory extraction incremental.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chat {

    /** Title prefix of conversations hidden from humans. */
    public static final String AGENT_ONLY_PREFIX = "[AGENT-ONLY]";

    private String id;
    private String accountId;
    private String title;

    private boolean manualResponses;
    private boolean archived;
    private boolean discarded;
    private boolean agentOnly;

    @Builder.Default
    private List<String> agentIds = new ArrayList<>();

    private String initiatedByAgentId;
    private String initiationReason;

    private Instant lastConsolidatedAt;
    private Long lastConsolidatedMessageId;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isGroupChat() {
        return manualResponses;
    }

    /**
     * Whether an agent may still post into this chat.
     */
    public boolean isRespondable() {
        return !archived && !discarded;
    }

    public boolean isInitiatedBy(String agentId) {
        return agentId != null && agentId.equals(initiatedByAgentId);
    }

    public void markConsolidated(Long lastMessageId, Instant at) {
        this.lastConsolidatedMessageId = lastMessageId;
        this.lastConsolidatedAt = at;
    }
}
