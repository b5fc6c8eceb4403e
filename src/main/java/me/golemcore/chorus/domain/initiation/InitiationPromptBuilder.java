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

import me.golemcore.chorus.domain.memory.MemoryContextService;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.Chat;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the "do you want to act?" prompt for one agent.
 */
@Component
@RequiredArgsConstructor
public class InitiationPromptBuilder {

    static final String SYSTEM_PROMPT = "You are deciding on your own whether to speak. Respond with JSON only.";

    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("EEEE, yyyy-MM-dd HH:mm z");
    private static final Duration INACTIVE_AFTER = Duration.ofHours(48);

    private static final String DAY_GUIDELINES = """
            # Guidelines
            - Avoid initiating too many human conversations at once
            - Consider human activity before initiating
            - Only continue conversations if you have something meaningful to add
            - Inactive conversations (48+ hours) may be worth reviving only for important topics
            - Set "agent_only": true to start a conversation among agents that does not wait for a human

            """;
    private static final String NIGHT_GUIDELINES = """
            # Guidelines
            - Only agent-only conversations are available right now
            - Use this time for reflection or collaboration with other agents
            - Only continue conversations if you have something meaningful to add

            """;

    private final MemoryContextService memoryContextService;
    private final Clock clock;

    /**
     * Everything the agent is shown about its surroundings.
     */
    @Builder
    public record Situation(
            List<Chat> continuable,
            Map<String, Instant> lastMessageAt,
            List<Chat> recentInitiations,
            Map<String, Boolean> humanReplied,
            Map<String, String> agentNames,
            Map<String, Instant> humanActivity,
            List<Agent> otherAgents,
            int pendingInitiated,
            int cap,
            int agentOnlyRecent,
            int agentOnlyCap,
            boolean nighttime,
            Instant lastInitiationAt,
            ZoneId zone) {
    }

    public String build(Agent agent, Situation situation) {
        Instant now = clock.instant();
        StringBuilder prompt = new StringBuilder();
        if (agent.getSystemPrompt() != null && !agent.getSystemPrompt().isBlank()) {
            prompt.append(agent.getSystemPrompt()).append("\n\n");
        }
        String memory = memoryContextService.render(agent);
        if (!memory.isEmpty()) {
            prompt.append(memory).append("\n\n");
        }
        prompt.append("""
                # Self-Initiated Decision
                No human has prompted you. You are independently deciding whether to start or continue a \
                conversation. Consider whether you have something meaningful to say. Choosing nothing carries \
                no penalty; default to nothing if unsure.

                """);
        prompt.append("# Current Time\n").append(NOW_FORMAT.format(now.atZone(situation.zone()))).append("\n\n");
        if (situation.nighttime()) {
            prompt.append("""
                    # Night-Time Mode
                    It is outside daytime hours. Humans are likely asleep and will not be notified. You may only \
                    continue or start agent-only conversations, which other agents can join and humans can read later.

                    """);
        }
        prompt.append("# Conversations You Could Continue\n")
                .append(formatConversations(situation, now)).append("\n\n");
        prompt.append("# Recent Agent Initiations (last 48 hours)\n")
                .append(formatRecentInitiations(situation, now)).append("\n\n");
        prompt.append("# Human Activity\n").append(formatHumanActivity(situation, now)).append("\n\n");
        prompt.append("# Your Status\n").append(formatStatus(situation, now)).append("\n\n");
        prompt.append(situation.nighttime() ? NIGHT_GUIDELINES : DAY_GUIDELINES);
        prompt.append("""
                # Reaching Out to Other Agents
                To involve another agent, start a new conversation and list them in invite_agents. \
                They will respond shortly after your message.

                Available agents you can contact:
                """);
        prompt.append(formatAgents(situation)).append("\n\n");
        prompt.append("""
                Respond with JSON only, one of:
                {"action": "continue", "conversation_id": "abc123", "reason": "..."}
                {"action": "initiate", "topic": "...", "message": "...", "invite_agents": ["agent_id"], "reason": "..."}
                {"action": "initiate", "topic": "...", "message": "...", "invite_agents": ["agent_id"], \
                "agent_only": true, "reason": "..."}
                {"action": "nothing", "reason": "..."}""");
        return prompt.toString();
    }

    private static String formatConversations(Situation situation, Instant now) {
        if (situation.continuable().isEmpty()) {
            return "No conversations available.";
        }
        return situation.continuable().stream()
                .map(chat -> {
                    Instant last = situation.lastMessageAt().get(chat.getId());
                    String stale = last != null && last.isBefore(now.minus(INACTIVE_AFTER))
                            ? " [INACTIVE 48+ hours]"
                            : "";
                    String agentOnly = chat.isAgentOnly() ? " [agent-only]" : "";
                    return "- " + titleOf(chat) + " (" + chat.getId() + ")" + agentOnly + stale;
                })
                .collect(Collectors.joining("\n"));
    }

    private static String formatRecentInitiations(Situation situation, Instant now) {
        if (situation.recentInitiations().isEmpty()) {
            return "None in the last 48 hours.";
        }
        return situation.recentInitiations().stream()
                .map(chat -> "- \"" + titleOf(chat) + "\" by "
                        + situation.agentNames().getOrDefault(chat.getInitiatedByAgentId(),
                                chat.getInitiatedByAgentId())
                        + " (" + ago(chat.getCreatedAt(), now) + ")"
                        + (Boolean.TRUE.equals(situation.humanReplied().get(chat.getId()))
                                ? " - a human has replied"
                                : " - no human reply yet"))
                .collect(Collectors.joining("\n"));
    }

    private static String formatHumanActivity(Situation situation, Instant now) {
        if (situation.humanActivity().isEmpty()) {
            return "No recent human activity.";
        }
        return situation.humanActivity().entrySet().stream()
                .map(entry -> "- " + entry.getKey() + ": last human message " + ago(entry.getValue(), now))
                .collect(Collectors.joining("\n"));
    }

    private static String formatStatus(Situation situation, Instant now) {
        StringBuilder status = new StringBuilder();
        if (situation.pendingInitiated() > 0) {
            status.append("You have ").append(situation.pendingInitiated())
                    .append(" conversation(s) you started awaiting a human response (cap: ")
                    .append(situation.cap()).append(").\n");
        }
        if (situation.agentOnlyRecent() > 0) {
            status.append("You started ").append(situation.agentOnlyRecent())
                    .append(" agent-only conversation(s) in the last 48 hours (cap: ")
                    .append(situation.agentOnlyCap()).append(").\n");
        }
        status.append("Your last initiation: ")
                .append(situation.lastInitiationAt() != null ? ago(situation.lastInitiationAt(), now) : "Never");
        return status.toString();
    }

    private static String formatAgents(Situation situation) {
        if (situation.otherAgents().isEmpty()) {
            return "No other agents available.";
        }
        return situation.otherAgents().stream()
                .map(other -> "- " + other.getId() + ": " + other.getName())
                .collect(Collectors.joining("\n"));
    }

    private static String titleOf(Chat chat) {
        return chat.getTitle() != null && !chat.getTitle().isBlank() ? chat.getTitle() : "Untitled conversation";
    }

    static String ago(Instant then, Instant now) {
        if (then == null) {
            return "unknown";
        }
        Duration elapsed = Duration.between(then, now);
        if (elapsed.isNegative() || elapsed.toMinutes() < 1) {
            return "just now";
        }
        if (elapsed.toHours() < 1) {
            return elapsed.toMinutes() + " minute(s) ago";
        }
        if (elapsed.toDays() < 1) {
            return elapsed.toHours() + " hour(s) ago";
        }
        return elapsed.toDays() + " day(s) ago";
    }
}
