package me.golemcore.chorus.domain.initiation;

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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.chorus.domain.model.InitiationAction;
import me.golemcore.chorus.domain.model.InitiationDecision;
import me.golemcore.chorus.domain.service.StructuredOutputParser;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a model reply into an {@link InitiationDecision}.
 *
 * <p>
 * Strict JSON first, then the first balanced-brace object in the prose. A
 * reply that yields neither becomes {@code nothing} with the failure reason and
 * a truncated copy of the reply.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionParser {

    static final String NO_OBJECT_REASON = "Could not extract decision from response";
    static final String INVALID_OBJECT_REASON = "Could not parse extracted JSON";

    private final StructuredOutputParser outputParser;
    private final ChorusProperties properties;

    public InitiationDecision parse(String reply) {
        Optional<JsonNode> strict = outputParser.parseStrict(reply);
        if (strict.isPresent()) {
            return toDecision(strict.get());
        }

        Optional<String> extracted = outputParser.extractFirstObject(reply);
        if (extracted.isEmpty()) {
            log.warn("[Initiation] Could not extract JSON from response: {}", truncate(reply, 200));
            return InitiationDecision.nothing(NO_OBJECT_REASON, truncate(reply, rawLimit()));
        }
        Optional<JsonNode> parsed = outputParser.parseStrict(extracted.get());
        if (parsed.isEmpty()) {
            log.warn("[Initiation] Extracted text was not valid JSON");
            return InitiationDecision.nothing(INVALID_OBJECT_REASON, truncate(reply, rawLimit()));
        }
        return toDecision(parsed.get());
    }

    private InitiationDecision toDecision(JsonNode json) {
        return InitiationDecision.builder()
                .action(InitiationAction.fromWire(outputParser.text(json, "action")))
                .conversationId(outputParser.text(json, "conversation_id"))
                .topic(outputParser.text(json, "topic"))
                .message(outputParser.text(json, "message"))
                .reason(outputParser.text(json, "reason"))
                .agentOnly(json.path("agent_only").asBoolean(false))
                .inviteAgents(outputParser.stringArray(json, "invite_agents"))
                .build();
    }

    private int rawLimit() {
        return properties.getInitiation().getRawResponseLimit();
    }

    static String truncate(String text, int limit) {
        if (text == null) {
            return "";
        }
        if (text.length() <= limit) {
            return text;
        }
        return limit <= 3 ? text.substring(0, limit) : text.substring(0, limit - 3) + "...";
    }
}
