package me.golemcore.chorus.domain.turn;

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

import me.golemcore.chorus.domain.component.ToolContext;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.ProviderErrorKind;
import me.golemcore.chorus.domain.model.ProviderSelection;
import me.golemcore.chorus.domain.model.RuntimeEvent;
import me.golemcore.chorus.domain.model.RuntimeEventType;
import me.golemcore.chorus.domain.model.ThinkingConfig;
import me.golemcore.chorus.domain.model.TurnOutcome;
import me.golemcore.chorus.domain.provider.MissingCapabilityException;
import me.golemcore.chorus.domain.provider.ProviderSelector;
import me.golemcore.chorus.domain.provider.UnsupportedThinkingException;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.BroadcastPort;
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import me.golemcore.chorus.port.outbound.ContextBuilderPort;
import me.golemcore.chorus.port.outbound.LlmPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drives one agent turn against the model.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Resolve provider and extended reasoning for the agent</li>
 * <li>Build the prompt through the context builder</li>
 * <li>Consume the model event stream with an {@link AgentTurn}</li>
 * <li>On failure classify, discard the empty partial reply and rethrow to the
 * task queue's retry policy</li>
 * </ol>
 *
 * <p>
 * A missing credential aborts the turn with a visible error and no retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseOrchestrator {

    private static final String TASK_NAME = "agent-turn";

    private final ChatRepositoryPort chatRepository;
    private final AgentRepositoryPort agentRepository;
    private final MessageRepositoryPort messageRepository;
    private final ContextBuilderPort contextBuilder;
    private final LlmPort llmPort;
    private final ProviderSelector providerSelector;
    private final ToolCatalog toolCatalog;
    private final BroadcastPort broadcastPort;
    private final TaskQueuePort taskQueue;
    private final TurnRetryPolicy turnRetryPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final ChorusProperties properties;
    private final Clock clock;

    /**
     * Submits a turn as its own retryable task.
     */
    public void schedule(String chatId, String agentId, String initiationReason, Duration delay) {
        taskQueue.submit(new TurnTask(chatId, agentId, initiationReason), delay, turnRetryPolicy.policy());
    }

    /**
     * Runs a turn synchronously. Provider failures are rethrown after cleanup.
     */
    public TurnOutcome runTurn(String chatId, String agentId, String initiationReason) {
        Chat chat = chatRepository.findById(chatId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown chat: " + chatId));
        Agent agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + agentId));

        ProviderSelection selection;
        try {
            selection = providerSelector.selectForAgent(agent);
        } catch (MissingCapabilityException e) {
            log.warn("[Turn] Aborting turn of agent {} in chat {}: {}", agentId, chatId, e.getMessage());
            broadcastError(chatId, agentId, "missing_capability", e.getMessage());
            return TurnOutcome.ABORTED;
        }

        LlmRequest request = contextBuilder.buildContext(chat, agent, initiationReason)
                .provider(selection)
                .tools(toolCatalog.toolsFor(agent))
                .toolContext(new ToolContext(agentId, chatId))
                .thinking(resolveThinking(agent, selection))
                .build();

        ChorusProperties.StreamProperties stream = properties.getStream();
        AgentTurn turn = new AgentTurn(chatId, agent, selection.logicalModelId(),
                Set.copyOf(properties.getTurn().getQuietTools()), stream.getContentFlushInterval(),
                stream.getReasoningFlushInterval(), messageRepository, broadcastPort, eventPublisher, clock);

        log.info("[Turn] Agent {} responding in chat {} via {} ({})", agentId, chatId,
                selection.provider().key(), selection.modelId());
        turn.start();
        try {
            llmPort.stream(request).doOnNext(turn::onEvent).blockLast();
            turn.complete();
            return TurnOutcome.COMPLETED;
        } catch (RuntimeException e) {
            ProviderErrorKind kind = ProviderErrorClassifier.classify(e);
            log.warn("[Turn] Agent {} failed in chat {} ({}): {}", agentId, chatId, kind, e.getMessage());
            turn.fail();
            broadcastError(chatId, agentId, kind.name().toLowerCase(Locale.ROOT), e.getMessage());
            if (kind == ProviderErrorKind.MODEL_NOT_FOUND) {
                log.info("[Turn] Refreshing model registry after unknown model {}", selection.logicalModelId());
                llmPort.refreshModelRegistry();
            }
            throw e;
        } finally {
            turn.cleanup();
        }
    }

    private ThinkingConfig resolveThinking(Agent agent, ProviderSelection selection) {
        if (!agent.isThinkingEnabled()) {
            return null;
        }
        try {
            return providerSelector.configureThinking(selection, agent.getThinkingBudget());
        } catch (UnsupportedThinkingException e) {
            log.warn("[Turn] Extended thinking unavailable for {}: {}", selection.logicalModelId(), e.getMessage());
            return null;
        }
    }

    private void broadcastError(String chatId, String agentId, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message != null ? message : "");
        broadcastPort.broadcast(RuntimeEvent.builder()
                .type(RuntimeEventType.TURN_ERROR)
                .timestamp(clock.instant())
                .chatId(chatId)
                .agentId(agentId)
                .payload(payload)
                .build());
    }

    private final class TurnTask implements TaskQueuePort.QueuedTask {

        private final String chatId;
        private final String agentId;
        private final String initiationReason;

        private TurnTask(String chatId, String agentId, String initiationReason) {
            this.chatId = chatId;
            this.agentId = agentId;
            this.initiationReason = initiationReason;
        }

        @Override
        public String name() {
            return TASK_NAME + ":" + chatId + ":" + agentId;
        }

        @Override
        public void run() {
            runTurn(chatId, agentId, initiationReason);
        }
    }
}
