package me.golemcore.chorus.adapter.outbound.context;

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

import me.golemcore.chorus.domain.memory.MemoryContextService;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.port.outbound.ContextBuilderPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a turn's prompt from the agent's system prompt, its memory and the
 * chat transcript.
 *
 * <p>
 * The agent's own replies stay assistant messages. Everybody else, humans and
 * other agents alike, is rendered as a user message prefixed with the author's
 * name so the agent can tell the voices apart.
 */
@Component
@RequiredArgsConstructor
public class TranscriptContextBuilder implements ContextBuilderPort {

    private final MessageRepositoryPort messageRepository;
    private final MemoryContextService memoryContextService;

    @Override
    public LlmRequest.LlmRequestBuilder buildContext(Chat chat, Agent agent, String initiationReason) {
        StringBuilder system = new StringBuilder();
        if (agent.getSystemPrompt() != null && !agent.getSystemPrompt().isBlank()) {
            system.append(agent.getSystemPrompt().trim());
        }
        String memory = memoryContextService.render(agent);
        if (!memory.isEmpty()) {
            appendSection(system, memory);
        }
        if (chat.isGroupChat()) {
            appendSection(system, "You are " + agent.getName() + " in a group conversation. "
                    + "Reply only as yourself; do not write other participants' lines.");
        }
        if (initiationReason != null && !initiationReason.isBlank()) {
            appendSection(system, "# Why you are speaking now\nNobody asked you to reply. You decided to "
                    + "continue this conversation yourself. Your reason: " + initiationReason.trim());
        }

        List<Message> history = new ArrayList<>();
        for (Message message : messageRepository.findAfter(chat.getId(), null)) {
            if (message.isToolMessage() || !message.hasContent()) {
                continue;
            }
            if (message.isAuthoredBy(agent.getId())) {
                history.add(Message.builder()
                        .role(Message.ROLE_ASSISTANT)
                        .content(message.getContent())
                        .build());
            } else {
                history.add(Message.builder()
                        .role(Message.ROLE_USER)
                        .content("[" + authorOf(message) + "]: " + message.getContent())
                        .build());
            }
        }

        return LlmRequest.builder()
                .systemPrompt(system.toString())
                .messages(history);
    }

    private static void appendSection(StringBuilder system, String section) {
        if (!system.isEmpty()) {
            system.append("\n\n");
        }
        system.append(section);
    }

    private static String authorOf(Message message) {
        if (message.getAuthorName() != null && !message.getAuthorName().isBlank()) {
            return message.getAuthorName();
        }
        return message.isUserMessage() ? "User" : "Assistant";
    }
}
