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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.service.AgentPromptService;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.AuditPort;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Consent-gated de-duplication of an agent's core memories.
 *
 * <p>
 * The agent is first asked whether it wants a session. Only on a reply that
 * starts with YES does it get a {@link RefinementSession} tool over its
 * ledger. Declining leaves memories and the refinement timestamp untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRefiner {

    private static final Pattern CONSENT = Pattern.compile("^YES\\b", Pattern.CASE_INSENSITIVE);

    private static final String CONSENT_PROMPT = """
            # Memory Refinement Request

            %s

            You may run a refinement session over your core memories. Refinement is de-duplication, \
            not compression: merge memories that say the same thing, fix phrasing, and delete exact \
            duplicates. Constitutional memories are never touched. Making zero changes is a valid outcome.

            Would you like to refine your core memories now?
            Reply with YES or NO as the first word.""";

    private static final String REFINEMENT_PROMPT = """
            # Memory Refinement Session

            %s

            This is de-duplication, not compression. Merge memories that express the same idea, \
            tighten wording that drifted, and delete exact duplicates. Do not discard distinct \
            memories to save space. Memories marked [CONSTITUTIONAL] cannot be deleted or merged.

            Use the memory_refinement tool. You may perform up to %d changes.

            ## Your Core Memory Ledger
            %s

            When you are done, call the tool with action "complete" and a short summary.""";

    private final AgentRepositoryPort agentRepository;
    private final MemoryRepositoryPort memoryRepository;
    private final MemoryContextService memoryContextService;
    private final AgentPromptService promptService;
    private final AuditPort auditPort;
    private final ObjectMapper objectMapper;
    private final ChorusProperties properties;
    private final Clock clock;

    /**
     * Refines every active agent that needs it. One agent failing does not
     * stop the sweep.
     *
     * @return number of sessions that ran
     */
    public int sweep() {
        int sessions = 0;
        for (Agent agent : agentRepository.findActive()) {
            if (!needsRefinement(agent)) {
                continue;
            }
            try {
                if (refine(agent).consented()) {
                    sessions++;
                }
            } catch (RuntimeException e) {
                log.warn("[Refinement] Agent {} failed: {}", agent.getId(), e.getMessage());
            }
        }
        return sessions;
    }

    public RefinementResult refine(String agentId) {
        Agent agent = agentRepository.findById(agentId)
                .orElseThrow(() -> new IllegalArgumentException("Agent not found: " + agentId));
        return refine(agent);
    }

    /**
     * An agent needs refinement when it has core memories and is either over
     * its token budget or has not refined within the interval.
     */
    public boolean needsRefinement(Agent agent) {
        List<AgentMemory> core = memoryContextService.coreMemories(agent.getId());
        if (core.isEmpty()) {
            return false;
        }
        int usage = core.stream().mapToInt(AgentMemory::getTokenEstimate).sum();
        if (usage > properties.getMemory().getCoreTokenBudget()) {
            return true;
        }
        Instant last = agent.getLastRefinementAt();
        return last == null || last.isBefore(clock.instant().minus(properties.getMemory().getRefinementInterval()));
    }

    public RefinementResult refine(Agent agent) {
        List<AgentMemory> core = memoryContextService.coreMemories(agent.getId());
        if (core.isEmpty()) {
            return RefinementResult.declined();
        }
        String status = statusBlock(core);
        String system = systemPrompt(agent);

        String answer = promptService.ask(agent, system, String.format(CONSENT_PROMPT, status));
        if (!CONSENT.matcher(answer.strip()).find()) {
            log.info("[Refinement] Agent {} declined refinement", agent.getId());
            return RefinementResult.declined();
        }

        int maxOperations = properties.getMemory().getRefinementMaxOperations();
        RefinementSession session = new RefinementSession(agent, maxOperations, memoryRepository,
                agentRepository, auditPort, objectMapper, clock);
        String ledger = core.stream().map(MemoryRefiner::ledgerLine).collect(Collectors.joining("\n"));
        try {
            promptService.ask(agent, system, String.format(REFINEMENT_PROMPT, status, maxOperations, ledger),
                    List.of(session));
        } finally {
            session.closeIfOpen();
        }

        Map<String, Integer> stats = session.getStats();
        log.info("[Refinement] Agent {} refined: {} ({} operations)", agent.getId(), stats,
                session.getOperations());
        return new RefinementResult(true, session.getOperations(), stats);
    }

    private String statusBlock(List<AgentMemory> core) {
        int usage = core.stream().mapToInt(AgentMemory::getTokenEstimate).sum();
        int budget = properties.getMemory().getCoreTokenBudget();
        String position = usage > budget
                ? "You are over budget by ~" + (usage - budget) + " tokens."
                : "You are within budget.";
        return "Core memories: " + core.size() + "\nToken usage: ~" + usage + " / " + budget + "\n" + position;
    }

    private String systemPrompt(Agent agent) {
        String base = agent.getSystemPrompt() != null ? agent.getSystemPrompt() : "";
        String memory = memoryContextService.render(agent);
        return memory.isEmpty() ? base : base + "\n\n" + memory;
    }

    static String ledgerLine(AgentMemory memory) {
        String day = memory.getCreatedAt() != null ? MemoryContextService.DAY_FORMAT.format(memory.getCreatedAt())
                : "unknown";
        return "- #" + memory.getId() + " (" + day + ", ~" + memory.getTokenEstimate() + " tokens)"
                + (memory.isConstitutional() ? " [CONSTITUTIONAL]" : "") + ": " + memory.getContent();
    }

    /**
     * Outcome of one refinement attempt.
     */
    public record RefinementResult(boolean consented, int operations, Map<String, Integer> stats) {

        public static RefinementResult declined() {
            return new RefinementResult(false, 0, Map.of());
        }
    }
}
