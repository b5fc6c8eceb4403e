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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed answer of an agent to "do you want to act?".
 */
@Data
@Builder
public class InitiationDecision {

    private InitiationAction action;
    private String conversationId;
    private String topic;
    private String message;
    private String reason;
    private boolean agentOnly;

    @Builder.Default
    private List<String> inviteAgents = new ArrayList<>();

    private String rawResponse;

    public static InitiationDecision nothing(String reason, String rawResponse) {
        return InitiationDecision.builder()
                .action(InitiationAction.NOTHING)
                .reason(reason)
                .rawResponse(rawResponse)
                .build();
    }

    public static InitiationDecision skipped(String reason) {
        return InitiationDecision.builder()
                .action(InitiationAction.SKIPPED)
                .reason(reason)
                .build();
    }

    /**
     * Audit payload containing only the populated fields.
     */
    public Map<String, Object> toAuditPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action.wireName());
        putIfPresent(payload, "topic", topic);
        putIfPresent(payload, "reason", reason);
        putIfPresent(payload, "conversation_id", conversationId);
        if (inviteAgents != null && !inviteAgents.isEmpty()) {
            payload.put("invite_agents", List.copyOf(inviteAgents));
        }
        if (agentOnly) {
            payload.put("agent_only", true);
        }
        putIfPresent(payload, "raw_response", rawResponse);
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
