package me.golemcore.chorus.domain.service;

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

import me.golemcore.chorus.domain.component.ToolComponent;
import me.golemcore.chorus.domain.component.ToolContext;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.ProviderErrorKind;
import me.golemcore.chorus.domain.provider.ProviderSelector;
import me.golemcore.chorus.domain.turn.ProviderCallException;
import me.golemcore.chorus.domain.turn.ProviderErrorClassifier;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot prompts to an agent's own model, outside of a chat turn. Used by the
 * memory sweeps and the initiation engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentPromptService {

    private final LlmPort llmPort;
    private final ProviderSelector providerSelector;
    private final ChorusProperties properties;
    private final Clock clock;

    public String ask(Agent agent, String systemPrompt, String userPrompt) {
        return ask(agent, systemPrompt, userPrompt, List.of());
    }

    /**
     * Sends the prompt and waits for the final reply.
     *
     * @return the reply text, never {@code null}
     * @throws ProviderCallException
     *             if the call fails or times out
     */
    public String ask(Agent agent, String systemPrompt, String userPrompt, List<ToolComponent> tools) {
        LlmRequest request = LlmRequest.builder()
                .provider(providerSelector.select(agent.getModelId()))
                .systemPrompt(systemPrompt)
                .messages(List.of(Message.builder()
                        .role(Message.ROLE_USER)
                        .content(userPrompt)
                        .build()))
                .tools(tools)
                .toolContext(new ToolContext(agent.getId(), null))
                .build();

        long timeoutMs = properties.getLlm().getRequestTimeout().toMillis();
        try {
            long start = clock.millis();
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[Prompt] Agent {} answered in {}ms", agent.getId(), clock.millis() - start);
            return response != null && response.getContent() != null ? response.getContent() : "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderCallException(ProviderErrorKind.NETWORK, "Prompt interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ProviderCallException(ProviderErrorClassifier.classify(cause),
                    "Prompt failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ProviderCallException(ProviderErrorKind.NETWORK, "Prompt timed out after " + timeoutMs + "ms",
                    e);
        }
    }
}
