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

import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AuditEntry;
import me.golemcore.chorus.domain.model.Chat;
import me.golemcore.chorus.domain.model.InitiationDecision;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.sequencer.MultiAgentSequencer;
import me.golemcore.chorus.domain.service.AgentPromptService;
import me.golemcore.chorus.domain.turn.ResponseOrchestrator;
import me.golemcore.chorus.domain.turn.TurnRetryPolicy;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.AuditPort;
import me.golemcore.chorus.port.outbound.ChatRepositoryPort;
import me.golemcore.chorus.port.outbound.MessageRepositoryPort;
import me.golemcore.chorus.port.outbound.NotificationPort;
import me.golemcore.chorus.port.outbound.TaskQueuePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Lets agents decide on their own whether to continue a conversation, start a
 * new one, or stay quiet.
 *
 * <p>
 * An agent whose started conversations already wait on humans up to its cap
 * is skipped before any model call. Every decision, including the skip, is
 * audited exactly once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InitiationDecisionEngine {

    static final String AT_HARD_CAP = "at_hard_cap";
    static final String AT_AGENT_ONLY_CAP = "at_agent_only_cap";

    private final AgentRepositoryPort agentRepository;
    private final ChatRepositoryPort chatRepository;
    private final MessageRepositoryPort messageRepository;
    private final AuditPort auditPort;
    private final NotificationPort notificationPort;
    private final AgentPromptService promptService;
    private final DecisionParser decisionParser;
    private final InitiationPromptBuilder promptBuilder;
    private final ResponseOrchestrator orchestrator;
    private final MultiAgentSequencer sequencer;
    private final TaskQueuePort taskQueue;
    private final TurnRetryPolicy turnRetryPolicy;
    private final ChorusProperties properties;
    private final Clock clock;

    /**
     * Queues one decision per active agent of an active account, each after a
     * random delay up to the configured jitter.
     *
     * @return number of decisions queued
     */
    public int sweep(SweepMode mode) {
        ChorusProperties.InitiationProperties settings = properties.getInitiation();
        if (!settings.isEnabled()) {
            return 0;
        }
        boolean daytime = isDaytime();
        if (mode == SweepMode.DAYTIME && !daytime) {
            log.debug("[Initiation] Outside daytime window, skipping sweep");
            return 0;
        }
        if (mode == SweepMode.BACKGROUND && daytime) {
            log.debug("[Initiation] Inside daytime window, skipping night sweep");
            return 0;
        }

        Map<String, Boolean> activeAccounts = new HashMap<>();
        int queued = 0;
        for (Agent agent : agentRepository.findActive()) {
            try {
                boolean active = activeAccounts.computeIfAbsent(agent.getAccountId(), this::isAccountActive);
                if (!active) {
                    continue;
                }
                taskQueue.submit(new DecisionTask(agent.getId(), mode), jitter(), turnRetryPolicy.policy());
                queued++;
            } catch (RuntimeException e) {
                log.warn("[Initiation] Could not queue agent {}: {}", agent.getId(), e.getMessage());
            }
        }
        log.info("[Initiation] {} sweep queued {} decision(s)", mode, queued);
        return queued;
    }

    /**
     * Asks one agent for a decision, carries it out and audits it. Model
     * failures propagate without an audit entry so the queue may retry.
     */
    public InitiationDecision decide(String agentId, SweepMode mode) {
        Agent agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new IllegalArgumentException("Agent not found: " + agentId));

        List<Chat> pending = pendingInitiated(agent);
        int cap = capOf(agent);
        if (pending.size() >= cap) {
            log.info("[Initiation] Agent {} at initiation cap ({}/{}), skipping", agent.getId(), pending.size(), cap);
            InitiationDecision skipped = InitiationDecision.skipped(AT_HARD_CAP);
            audit(agent, skipped);
            return skipped;
        }
        int agentOnlyRecent = recentAgentOnlyInitiations(agent).size();
        int agentOnlyCap = properties.getInitiation().getAgentOnlyCap();
        if (mode.agentOnly() && agentOnlyRecent >= agentOnlyCap) {
            log.info("[Initiation] Agent {} at agent-only cap ({}/{}), skipping night sweep", agent.getId(),
                    agentOnlyRecent, agentOnlyCap);
            InitiationDecision skipped = InitiationDecision.skipped(AT_AGENT_ONLY_CAP);
            audit(agent, skipped);
            return skipped;
        }

        String prompt = promptBuilder.build(agent, situation(agent, mode, pending.size(), cap, agentOnlyRecent));
        String reply = promptService.ask(agent, InitiationPromptBuilder.SYSTEM_PROMPT, prompt);
        InitiationDecision decision = decisionParser.parse(reply);
        log.info("[Initiation] Agent {} decided: {}", agent.getId(), decision.getAction().wireName());

        execute(agent, decision, mode);
        audit(agent, decision);
        return decision;
    }

    /**
     * Human conversations the agent started that are still kept and have no
     * human message. Agent-only chats never count here.
     */
    public List<Chat> pendingInitiated(Agent agent) {
        return chatRepository.findInitiatedBy(agent.getId()).stream()
                .filter(chat -> !chat.isDiscarded())
                .filter(chat -> !chat.isAgentOnly())
                .filter(chat -> !messageRepository.hasHumanMessageSince(chat.getId(), since(chat)))
                .toList();
    }

    /**
     * Agent-only chats the agent started within the recent-initiation window.
     */
    public List<Chat> recentAgentOnlyInitiations(Agent agent) {
        Instant since = clock.instant().minus(properties.getInitiation().getRecentlyInitiatedWindow());
        return chatRepository.findInitiatedBy(agent.getId()).stream()
                .filter(chat -> !chat.isDiscarded())
                .filter(Chat::isAgentOnly)
                .filter(chat -> chat.getCreatedAt() != null && !chat.getCreatedAt().isBefore(since))
                .toList();
    }

    public boolean isAccountActive(String accountId) {
        Instant since = clock.instant().minus(properties.getInitiation().getActivityWindow());
        return auditPort.existsForAccountSince(accountId, since)
                || messageRepository.existsHumanMessageForAccountSince(accountId, since);
    }

    /**
     * Whether the current hour in the configured zone lies in the daytime
     * window. Both the start and the end hour are included.
     */
    public boolean isDaytime() {
        ChorusProperties.InitiationProperties settings = properties.getInitiation();
        int hour = clock.instant().atZone(zone()).getHour();
        return hour >= settings.getDaytimeStartHour() && hour <= settings.getDaytimeEndHour();
    }

    private void execute(Agent agent, InitiationDecision decision, SweepMode mode) {
        switch (decision.getAction()) {
        case CONTINUE -> continueConversation(agent, decision, mode);
        case INITIATE -> initiateConversation(agent, decision, mode);
        case NOTHING -> notifyNonAction(agent, decision.getReason(), mode);
        default -> log.debug("[Initiation] Nothing to execute for {}", decision.getAction());
        }
    }

    private void continueConversation(Agent agent, InitiationDecision decision, SweepMode mode) {
        String chatId = decision.getConversationId();
        Optional<Chat> chat = chatId != null ? chatRepository.findById(chatId) : Optional.empty();
        boolean usable = chat
                .filter(candidate -> Objects.equals(candidate.getAccountId(), agent.getAccountId()))
                .filter(Chat::isRespondable)
                .isPresent();
        if (!usable) {
            log.info("[Initiation] Agent {} chose conversation {} which is not respondable", agent.getId(), chatId);
            notifyNonAction(agent, "Chose to continue conversation " + chatId + " but it's not respondable", mode);
            return;
        }
        if (mode.agentOnly() && !chat.get().isAgentOnly()) {
            log.info("[Initiation] Agent {} chose human conversation {} during night sweep, ignoring", agent.getId(),
                    chatId);
            return;
        }
        orchestrator.schedule(chatId, agent.getId(), decision.getReason(), Duration.ZERO);
    }

    private void initiateConversation(Agent agent, InitiationDecision decision, SweepMode mode) {
        if (decision.getMessage() == null || decision.getMessage().isBlank()) {
            notifyNonAction(agent, "Wanted to initiate '" + decision.getTopic() + "' without an opening message",
                    mode);
            return;
        }
        boolean agentOnly = decision.isAgentOnly() || mode.agentOnly();
        if (agentOnly && recentAgentOnlyInitiations(agent).size() >= properties.getInitiation().getAgentOnlyCap()) {
            notifyNonAction(agent, "Wanted to start agent-only conversation '" + decision.getTopic()
                    + "' but at agent-only initiation cap", mode);
            return;
        }
        decision.setAgentOnly(agentOnly);
        Instant now = clock.instant();
        List<String> invited = resolveInvitees(agent, decision.getInviteAgents());
        List<String> participants = new ArrayList<>();
        participants.add(agent.getId());
        participants.addAll(invited);

        Chat chat = chatRepository.save(Chat.builder()
                .id(UUID.randomUUID().toString())
                .accountId(agent.getAccountId())
                .title(titleFor(agent, decision.getTopic(), agentOnly))
                .manualResponses(true)
                .agentOnly(agentOnly)
                .agentIds(participants)
                .initiatedByAgentId(agent.getId())
                .initiationReason(decision.getReason())
                .createdAt(now)
                .updatedAt(now)
                .build());
        messageRepository.create(Message.builder()
                .chatId(chat.getId())
                .role(Message.ROLE_ASSISTANT)
                .agentId(agent.getId())
                .authorName(agent.getName())
                .content(decision.getMessage())
                .modelId(agent.getModelId())
                .createdAt(now)
                .build());
        decision.setConversationId(chat.getId());
        log.info("[Initiation] Agent {} started {}chat {} with {} invited agent(s)", agent.getId(),
                agentOnly ? "agent-only " : "", chat.getId(), invited.size());

        sequencer.start(chat.getId(), invited);
    }

    private static String titleFor(Agent agent, String topic, boolean agentOnly) {
        String title = topic != null && !topic.isBlank() ? topic.trim()
                : "Conversation started by " + agent.getName();
        if (agentOnly && !title.startsWith(Chat.AGENT_ONLY_PREFIX)) {
            return Chat.AGENT_ONLY_PREFIX + " " + title;
        }
        return title;
    }

    private List<String> resolveInvitees(Agent agent, List<String> requested) {
        if (requested == null) {
            return List.of();
        }
        return requested.stream()
                .distinct()
                .filter(id -> !id.equals(agent.getId()))
                .map(agentRepository::findById)
                .flatMap(Optional::stream)
                .filter(Agent::isActive)
                .filter(other -> Objects.equals(other.getAccountId(), agent.getAccountId()))
                .map(Agent::getId)
                .toList();
    }

    private void notifyNonAction(Agent agent, String reason, SweepMode mode) {
        if (!mode.notifiesNonAction()) {
            return;
        }
        try {
            notificationPort.notifyNonInitiation(agent, reason != null ? reason : "");
        } catch (RuntimeException e) {
            log.warn("[Initiation] Notification for agent {} failed: {}", agent.getId(), e.getMessage());
        }
    }

    private void audit(Agent agent, InitiationDecision decision) {
        auditPort.record(AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .accountId(agent.getAccountId())
                .agentId(agent.getId())
                .action(decision.getAction().auditAction())
                .payload(decision.toAuditPayload())
                .createdAt(clock.instant())
                .build());
    }

    private InitiationPromptBuilder.Situation situation(Agent agent, SweepMode mode, int pending, int cap,
            int agentOnlyRecent) {
        ChorusProperties.InitiationProperties settings = properties.getInitiation();
        Instant now = clock.instant();
        List<Chat> accountChats = chatRepository.findByAccount(agent.getAccountId());

        Map<String, Instant> lastMessageAt = new HashMap<>();
        List<Chat> continuable = new ArrayList<>();
        for (Chat chat : accountChats) {
            if (!chat.isGroupChat() || !chat.isRespondable() || !chat.getAgentIds().contains(agent.getId())) {
                continue;
            }
            if (mode.agentOnly() && !chat.isAgentOnly()) {
                continue;
            }
            Optional<Message> latest = messageRepository.findLatest(chat.getId());
            if (latest.isPresent() && latest.get().isAuthoredBy(agent.getId())) {
                continue;
            }
            latest.ifPresent(message -> lastMessageAt.put(chat.getId(), message.getCreatedAt()));
            continuable.add(chat);
        }
        continuable = continuable.stream()
                .sorted(Comparator.comparing(Chat::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(settings.getContinuableLimit())
                .toList();

        Instant recentSince = now.minus(settings.getRecentlyInitiatedWindow());
        List<Chat> recent = accountChats.stream()
                .filter(chat -> chat.getInitiatedByAgentId() != null)
                .filter(chat -> chat.getCreatedAt() != null && !chat.getCreatedAt().isBefore(recentSince))
                .toList();
        Map<String, Boolean> humanReplied = new HashMap<>();
        Map<String, String> agentNames = new HashMap<>();
        for (Chat chat : recent) {
            humanReplied.put(chat.getId(), messageRepository.hasHumanMessageSince(chat.getId(), since(chat)));
            agentRepository.findById(chat.getInitiatedByAgentId())
                    .ifPresent(initiator -> agentNames.put(initiator.getId(), initiator.getName()));
        }

        List<Agent> others = agentRepository.findActive().stream()
                .filter(other -> !other.getId().equals(agent.getId()))
                .filter(other -> Objects.equals(other.getAccountId(), agent.getAccountId()))
                .toList();

        Instant lastInitiation = chatRepository.findInitiatedBy(agent.getId()).stream()
                .map(Chat::getCreatedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return InitiationPromptBuilder.Situation.builder()
                .continuable(continuable)
                .lastMessageAt(lastMessageAt)
                .recentInitiations(recent)
                .humanReplied(humanReplied)
                .agentNames(agentNames)
                .humanActivity(humanActivity(accountChats, now.minus(settings.getActivityWindow())))
                .otherAgents(others)
                .pendingInitiated(pending)
                .cap(cap)
                .agentOnlyRecent(agentOnlyRecent)
                .agentOnlyCap(properties.getInitiation().getAgentOnlyCap())
                .nighttime(mode.agentOnly())
                .lastInitiationAt(lastInitiation)
                .zone(zone())
                .build();
    }

    private Map<String, Instant> humanActivity(List<Chat> chats, Instant since) {
        Map<String, Instant> activity = new LinkedHashMap<>();
        for (Chat chat : chats) {
            if (chat.isDiscarded()) {
                continue;
            }
            messageRepository.findAfter(chat.getId(), null).stream()
                    .filter(this::isHumanMessage)
                    .map(Message::getCreatedAt)
                    .filter(Objects::nonNull)
                    .filter(at -> !at.isBefore(since))
                    .max(Comparator.naturalOrder())
                    .ifPresent(at -> activity.put(chat.getTitle() != null ? chat.getTitle() : chat.getId(), at));
        }
        return activity;
    }

    private boolean isHumanMessage(Message message) {
        return message.isUserMessage() && message.getAgentId() == null;
    }

    private int capOf(Agent agent) {
        return agent.getInitiationCap() != null ? agent.getInitiationCap() : properties.getInitiation().getCap();
    }

    private Duration jitter() {
        long maxMillis = properties.getInitiation().getMaxJitter().toMillis();
        return maxMillis <= 0 ? Duration.ZERO : Duration.ofMillis(ThreadLocalRandom.current().nextLong(maxMillis));
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getInitiation().getTimezone());
    }

    private static Instant since(Chat chat) {
        return chat.getCreatedAt() != null ? chat.getCreatedAt() : Instant.EPOCH;
    }

    private final class DecisionTask implements TaskQueuePort.QueuedTask {

        private final String agentId;
        private final SweepMode mode;

        private DecisionTask(String agentId, SweepMode mode) {
            this.agentId = agentId;
            this.mode = mode;
        }

        @Override
        public String name() {
            return "initiation-decision:" + agentId + ":" + mode.name().toLowerCase(Locale.ROOT);
        }

        @Override
        public void run() {
            decide(agentId, mode);
        }
    }
}
