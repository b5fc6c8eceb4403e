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

import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.LlmEvent;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.MessageFinalizedEvent;
import me.golemcore.chorus.domain.model.RuntimeEvent;
import me.golemcore.chorus.domain.model.RuntimeEventType;
import me.golemcore.chorus.domain.stream.StreamBuffer;
import me.golemcore.chorus.port.outbound.BroadcastPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one agent turn, driven by the ordered model event stream.
 *
 * <p>
 * Owns the reply message being streamed and the two debounce buffers. At most
 * one message of the turn is streaming at a time. Not thread-safe: events of a
 * turn are consumed sequentially.
 */
@Slf4j
public class AgentTurn {

    static final String SAFETY_FILTERED_MESSAGE = "_The AI was unable to respond due to content safety filters. "
            + "Try rephrasing your message or starting a new conversation._";
    static final String INCOMPLETE_MESSAGE_TEMPLATE = "_The AI was unable to complete its response (reason: %s). "
            + "Please try again._";
    static final String EMPTY_RESPONSE_MESSAGE = "_The AI returned an empty response. This may be due to content "
            + "filtering or a temporary issue. Please try again._";

    private static final Set<String> SAFETY_REASONS = Set.of("SAFETY", "CONTENT_FILTER", "CONTENT_FILTERED");
    private static final String URL_ARGUMENT = "url";

    public enum State {
        IDLE, AWAITING_FIRST_EVENT, STREAMING, FINALIZING, SUCCEEDED, FAILED
    }

    private final String chatId;
    private final Agent agent;
    private final String fallbackModelId;
    private final Set<String> quietTools;
    private final MessageRepositoryPort messageRepository;
    private final BroadcastPort broadcastPort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final StreamBuffer contentBuffer;
    private final StreamBuffer reasoningBuffer;
    private final Set<String> toolsUsed = new LinkedHashSet<>();
    private final List<Message> finalizedMessages = new ArrayList<>();

    private State state = State.IDLE;
    private Message current;
    private LlmResponse pendingToolRound;

    @SuppressWarnings("java:S107") // collaborators of one turn, built per call by the orchestrator
    public AgentTurn(String chatId, Agent agent, String fallbackModelId, Set<String> quietTools,
            Duration contentInterval, Duration reasoningInterval, MessageRepositoryPort messageRepository,
            BroadcastPort broadcastPort, ApplicationEventPublisher eventPublisher, Clock clock) {
        this.chatId = chatId;
        this.agent = agent;
        this.fallbackModelId = fallbackModelId;
        this.quietTools = quietTools;
        this.contentBuffer = new StreamBuffer(contentInterval);
        this.reasoningBuffer = new StreamBuffer(reasoningInterval);
        this.messageRepository = messageRepository;
        this.broadcastPort = broadcastPort;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void start() {
        state = State.AWAITING_FIRST_EVENT;
    }

    public void onEvent(LlmEvent event) {
        if (event instanceof LlmEvent.NewMessage) {
            onNewMessage();
        } else if (event instanceof LlmEvent.ContentDelta delta) {
            onContent(delta.text());
        } else if (event instanceof LlmEvent.ReasoningDelta delta) {
            onReasoning(delta.text());
        } else if (event instanceof LlmEvent.ToolCallRequested toolCall) {
            onToolCall(toolCall.call());
        } else if (event instanceof LlmEvent.EndMessage end) {
            onEndMessage(end);
        }
    }

    void onNewMessage() {
        state = State.STREAMING;
        if (current != null && current.isStreaming()) {
            forceFlush();
            if (!current.hasContent()) {
                // Reply without text so far (tool-only round): keep writing into it
                return;
            }
            stopStreaming(current);
        }
        Instant now = clock.instant();
        current = messageRepository.create(Message.builder()
                .chatId(chatId)
                .role(Message.ROLE_ASSISTANT)
                .agentId(agent.getId())
                .authorName(agent.getName())
                .content("")
                .reasoning("")
                .streaming(true)
                .toolsUsed(new ArrayList<>())
                .createdAt(now)
                .build());
        contentBuffer.reset(now);
        reasoningBuffer.reset(now);
        broadcast(RuntimeEventType.MESSAGE_STARTED, Map.of());
    }

    void onContent(String text) {
        ensureMessage();
        contentBuffer.enqueue(text);
        flushIfDue(contentBuffer, true);
    }

    void onReasoning(String text) {
        ensureMessage();
        reasoningBuffer.enqueue(text);
        flushIfDue(reasoningBuffer, false);
    }

    void onToolCall(Message.ToolCall call) {
        if (call == null || call.getName() == null) {
            return;
        }
        toolsUsed.add(toolUsageKey(call));
        if (quietTools.contains(call.getName())) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", call.getName());
        payload.put("arguments", call.getArguments() != null ? call.getArguments() : Map.of());
        broadcast(RuntimeEventType.TOOL_CALL, payload);
    }

    void onEndMessage(LlmEvent.EndMessage end) {
        if (end.toolResult()) {
            return;
        }
        if (current == null) {
            log.debug("[Turn] End of message without an open reply in chat {}", chatId);
            return;
        }
        LlmResponse response = end.response() != null ? end.response() : LlmResponse.builder().build();
        forceFlush();
        if (response.hasToolCalls() && !hasText(resolveContent(response))) {
            // Tool round without text; the reply continues in the next round
            pendingToolRound = response;
            return;
        }
        finalizeReply(response);
    }

    private void finalizeReply(LlmResponse response) {
        state = State.FINALIZING;
        String content = resolveContent(response);
        if (!hasText(content) && response.outputTokens() == 0) {
            content = emptyReplyMessage(response.normalizedFinishReason());
        }
        String reasoning = hasText(response.getReasoning()) ? response.getReasoning()
                : reasoningBuffer.accumulated();

        current.setContent(content);
        current.setReasoning(reasoning);
        current.setModelId(response.getModel() != null ? response.getModel() : fallbackModelId);
        current.setInputTokens(response.inputTokens());
        current.setOutputTokens(response.outputTokens());
        current.setToolsUsed(new ArrayList<>(toolsUsed));
        current.setStreaming(false);
        messageRepository.update(current);
        Message saved = current;
        finalizedMessages.add(saved);
        broadcast(RuntimeEventType.MESSAGE_FINALIZED, Map.of("content", content != null ? content : ""));
        if (saved.hasContent()) {
            eventPublisher.publishEvent(new MessageFinalizedEvent(chatId, saved.getId(), agent.getId()));
        }
        log.debug("[Turn] Finalized message {} for agent {} ({} output tokens)", saved.getId(), agent.getId(),
                response.outputTokens());
        current = null;
        pendingToolRound = null;
    }

    /**
     * Drains both buffers into the open reply. Calling it again with nothing
     * enqueued writes nothing.
     */
    public void forceFlush() {
        flush(contentBuffer, true);
        flush(reasoningBuffer, false);
    }

    /**
     * Ends a successful turn. A reply still open after a tool-only round (the
     * provider stopped at its tool-round limit) is finalized with that round's
     * response.
     */
    public void complete() {
        if (current != null && current.isStreaming() && pendingToolRound != null) {
            log.debug("[Turn] Finalizing reply {} left open by a tool round in chat {}", current.getId(), chatId);
            forceFlush();
            finalizeReply(pendingToolRound);
        }
        state = State.SUCCEEDED;
    }

    /**
     * Marks the turn failed and deletes the open reply if it never got content.
     */
    public void fail() {
        state = State.FAILED;
        forceFlush();
        if (current != null && current.isStreaming() && !current.hasContent()) {
            log.info("[Turn] Discarding empty partial message {} in chat {}", current.getId(), chatId);
            messageRepository.delete(current.getId());
            current = null;
        }
    }

    /**
     * Always runs on the way out: flush whatever is pending and stop streaming.
     */
    public void cleanup() {
        forceFlush();
        if (current != null && current.isStreaming()) {
            stopStreaming(current);
            current = null;
        }
    }

    public State getState() {
        return state;
    }

    public List<Message> getFinalizedMessages() {
        return List.copyOf(finalizedMessages);
    }

    public List<String> getToolsUsed() {
        return List.copyOf(toolsUsed);
    }

    static String emptyReplyMessage(String finishReason) {
        if (finishReason != null && SAFETY_REASONS.contains(finishReason)) {
            return SAFETY_FILTERED_MESSAGE;
        }
        if (finishReason != null && !LlmResponse.FINISH_STOP.equals(finishReason)) {
            return String.format(INCOMPLETE_MESSAGE_TEMPLATE, finishReason);
        }
        return EMPTY_RESPONSE_MESSAGE;
    }

    private String resolveContent(LlmResponse response) {
        if (hasText(response.getContent())) {
            return response.getContent();
        }
        if (hasText(contentBuffer.accumulated())) {
            return contentBuffer.accumulated();
        }
        return messageRepository.findById(current.getId())
                .map(Message::getContent)
                .orElse(null);
    }

    private void ensureMessage() {
        if (current == null) {
            onNewMessage();
        }
    }

    private void flushIfDue(StreamBuffer buffer, boolean content) {
        if (buffer.shouldFlush(clock.instant())) {
            flush(buffer, content);
        }
    }

    private void flush(StreamBuffer buffer, boolean content) {
        if (current == null) {
            return;
        }
        String chunk = buffer.drain(clock.instant());
        if (chunk == null) {
            return;
        }
        if (content) {
            current.setContent(nullToEmpty(current.getContent()) + chunk);
        } else {
            current.setReasoning(nullToEmpty(current.getReasoning()) + chunk);
        }
        messageRepository.update(current);
        broadcast(content ? RuntimeEventType.STREAM_CONTENT : RuntimeEventType.STREAM_REASONING,
                Map.of("delta", chunk));
    }

    private void stopStreaming(Message message) {
        message.setStreaming(false);
        messageRepository.update(message);
        broadcast(RuntimeEventType.STREAMING_STOPPED, Map.of());
    }

    private void broadcast(RuntimeEventType type, Map<String, Object> payload) {
        broadcastPort.broadcast(RuntimeEvent.builder()
                .type(type)
                .timestamp(clock.instant())
                .chatId(chatId)
                .messageId(current != null ? current.getId() : null)
                .agentId(agent.getId())
                .payload(payload)
                .build());
    }

    private static String toolUsageKey(Message.ToolCall call) {
        Map<String, Object> arguments = call.getArguments();
        if (arguments != null && arguments.get(URL_ARGUMENT) instanceof String url && !url.isBlank()) {
            return url;
        }
        return call.getName();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
