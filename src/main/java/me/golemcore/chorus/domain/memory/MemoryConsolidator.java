package me.golemcore.chorus.domain.memory;

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
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.ExtractedMemories;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.RetryPolicy;
import me.golemcore.chorus.domain.service.AgentPromptService;
import me.golemcore.chorus.domain.service.StructuredOutputParser;
import me.golemcore.chorus.domain.service.TokenEstimator;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns idle group-chat transcripts into journal and core memories for every
 * agent of the chat.
 *
 * <p>
 * Only messages after the chat's watermark are read. The watermark always
 * advances to the last processed message, even when extraction fails, so a
 * transcript is never consolidated twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryConsolidator {

    private static final String SYSTEM_PROMPT = """
            You maintain your own long-term memory. You read conversations you took part in \
            and write down what is worth remembering, in your own voice.""";

    private static final String EXTRACTION_PROMPT = """
            You are %s. Read the conversation below and decide what, if anything, you want to remember.

            Two kinds of memory exist:
            - journal: observations and events from this conversation. They fade after a week.
            - core: lasting insights about yourself, the people you talk to, or your role. They are permanent.

            Most conversations produce a few journal entries and no core memories. Do not repeat \
            anything you already hold as a core memory. Returning nothing is fine.

            Your existing core memories:
            %s""";

    private static final String JSON_FORMAT_INSTRUCTION = """


            Respond ONLY with valid JSON in this exact format:
            {"journal": ["observation 1", "observation 2"], "core": ["lasting insight"]}

            Use empty arrays when there is nothing to remember:
            {"journal": [], "core": []}""";

    private static final String TRANSCRIPT_SEPARATOR = "\n\n---\n\nConversation:\n\n";

    private final ChatRepositoryPort chatRepository;
    private final MessageRepositoryPort messageRepository;
    private final AgentRepositoryPort agentRepository;
    private final MemoryRepositoryPort memoryRepository;
    private final MemoryContextService memoryContextService;
    private final AgentPromptService promptService;
    private final StructuredOutputParser outputParser;
    private final TaskQueuePort taskQueue;
    private final ChorusProperties properties;
    private final Clock clock;

    /**
     * Submits one consolidation task per idle group chat with unconsolidated
     * messages.
     *
     * @return number of chats submitted
     */
    public int sweep() {
        int submitted = 0;
        for (Chat chat : chatRepository.findGroupChats()) {
            try {
                if (isEligible(chat) && hasUnconsolidatedMessages(chat)) {
                    String chatId = chat.getId();
                    taskQueue.submit(new ConsolidationTask(chatId), Duration.ZERO, RetryPolicy.none());
                    submitted++;
                }
            } catch (RuntimeException e) {
                log.warn("[Consolidation] Failed to check chat {}: {}", chat.getId(), e.getMessage());
            }
        }
        if (submitted > 0) {
            log.info("[Consolidation] Submitted {} idle chat(s)", submitted);
        }
        return submitted;
    }

    /**
     * Consolidates one chat.
     *
     * @return number of memories created
     */
    public int consolidate(String chatId) {
        Optional<Chat> found = chatRepository.findById(chatId);
        if (found.isEmpty()) {
            log.debug("[Consolidation] Chat {} no longer exists", chatId);
            return 0;
        }
        Chat chat = found.get();
        if (!isEligible(chat)) {
            log.debug("[Consolidation] Chat {} is not an idle group chat", chatId);
            return 0;
        }

        List<Message> messages = messageRepository.findAfter(chatId, chat.getLastConsolidatedMessageId());
        if (messages.isEmpty()) {
            return 0;
        }

        List<Message> transcript = messages.stream()
                .filter(message -> !message.isToolMessage())
                .filter(Message::hasContent)
                .toList();
        List<List<Message>> chunks = TranscriptChunker.chunk(transcript,
                properties.getMemory().getChunkTargetTokens(), this::formatLine);

        int created = 0;
        for (String agentId : chat.getAgentIds()) {
            Optional<Agent> agent = agentRepository.findById(agentId);
            if (agent.isEmpty()) {
                continue;
            }
            try {
                created += extractForAgent(agent.get(), chunks);
            } catch (RuntimeException e) {
                log.warn("[Consolidation] Agent {} failed on chat {}: {}", agentId, chatId, e.getMessage());
            }
        }

        Message last = messages.get(messages.size() - 1);
        chat.markConsolidated(last.getId(), clock.instant());
        chatRepository.save(chat);
        log.info("[Consolidation] Chat {}: {} messages in {} chunk(s), {} memories created", chatId,
                messages.size(), chunks.size(), created);
        return created;
    }

    boolean isEligible(Chat chat) {
        if (!chat.isGroupChat()) {
            return false;
        }
        Instant idleSince = clock.instant().minus(properties.getMemory().getIdleThreshold());
        return messageRepository.findLatest(chat.getId())
                .map(latest -> latest.getCreatedAt() == null || !latest.getCreatedAt().isAfter(idleSince))
                .orElse(true);
    }

    private boolean hasUnconsolidatedMessages(Chat chat) {
        return messageRepository.findLatest(chat.getId())
                .map(latest -> chat.getLastConsolidatedMessageId() == null
                        || latest.getId() > chat.getLastConsolidatedMessageId())
                .orElse(false);
    }

    private int extractForAgent(Agent agent, List<List<Message>> chunks) {
        List<String> knownCore = memoryContextService.coreMemories(agent.getId()).stream()
                .map(AgentMemory::getContent)
                .collect(Collectors.toCollection(ArrayList::new));

        int created = 0;
        for (List<Message> chunk : chunks) {
            ExtractedMemories extracted = extract(agent, chunk, knownCore);
            created += store(agent, extracted.journal(), MemoryType.JOURNAL);
            created += store(agent, extracted.core(), MemoryType.CORE);
            knownCore.addAll(extracted.core());
        }
        return created;
    }

    ExtractedMemories extract(Agent agent, List<Message> chunk, List<String> knownCore) {
        String prompt = buildPrompt(agent, knownCore)
                + TRANSCRIPT_SEPARATOR
                + chunk.stream().map(this::formatLine).collect(Collectors.joining("\n\n"));
        String reply;
        try {
            reply = promptService.ask(agent, SYSTEM_PROMPT, prompt);
        } catch (RuntimeException e) {
            log.warn("[Consolidation] Extraction call failed for agent {}: {}", agent.getId(), e.getMessage());
            return ExtractedMemories.empty();
        }
        Optional<JsonNode> json = outputParser.parseLenient(reply);
        if (json.isEmpty()) {
            log.warn("[Consolidation] Unparseable extraction from agent {}", agent.getId());
            return ExtractedMemories.empty();
        }
        return new ExtractedMemories(outputParser.stringArray(json.get(), "journal"),
                outputParser.stringArray(json.get(), "core"));
    }

    private String buildPrompt(Agent agent, List<String> knownCore) {
        String existing = knownCore.isEmpty()
                ? "None yet."
                : knownCore.stream().map(content -> "- " + content).collect(Collectors.joining("\n"));
        return String.format(EXTRACTION_PROMPT, agent.getName(), existing) + JSON_FORMAT_INSTRUCTION;
    }

    private int store(Agent agent, List<String> contents, MemoryType type) {
        Instant now = clock.instant();
        for (String content : contents) {
            memoryRepository.create(AgentMemory.builder()
                    .agentId(agent.getId())
                    .memoryType(type)
                    .content(content)
                    .tokenEstimate(TokenEstimator.estimate(content))
                    .createdAt(now)
                    .build());
        }
        return contents.size();
    }

    private String formatLine(Message message) {
        String author = message.getAuthorName();
        if (author == null || author.isBlank()) {
            author = message.isUserMessage() ? "User" : "Assistant";
        }
        return "[" + author + "]: " + message.getContent();
    }

    private final class ConsolidationTask implements TaskQueuePort.QueuedTask {

        private final String chatId;

        private ConsolidationTask(String chatId) {
            this.chatId = chatId;
        }

        @Override
        public String name() {
            return "consolidate:" + chatId;
        }

        @Override
        public void run() {
            consolidate(chatId);
        }
    }
}
