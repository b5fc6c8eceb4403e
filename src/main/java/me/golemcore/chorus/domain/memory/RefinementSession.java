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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chorus.domain.component.ToolComponent;
import me.golemcore.chorus.domain.component.ToolContext;
import me.golemcore.chorus.domain.model.Agent;
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.AuditEntry;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.ToolDefinition;
import me.golemcore.chorus.domain.model.ToolResult;
import me.golemcore.chorus.domain.service.TokenEstimator;
import me.golemcore.chorus.port.outbound.AgentRepositoryPort;
import me.golemcore.chorus.port.outbound.AuditPort;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Tool handed to an agent for one consented refinement session over its own
 * core-memory ledger.
 *
 * <p>
 * Constitutional memories cannot be deleted or merged. Mutating actions count
 * against the session's operation cap; {@code search} and {@code complete} do
 * not.
 */
@Slf4j
public class RefinementSession implements ToolComponent {

    public static final String TOOL_NAME = "memory_refinement";

    static final String ACTION_SEARCH = "search";
    static final String ACTION_CONSOLIDATE = "consolidate";
    static final String ACTION_UPDATE = "update";
    static final String ACTION_DELETE = "delete";
    static final String ACTION_PROTECT = "protect";
    static final String ACTION_COMPLETE = "complete";

    private static final List<String> ACTIONS = List.of(ACTION_SEARCH, ACTION_CONSOLIDATE, ACTION_UPDATE,
            ACTION_DELETE, ACTION_PROTECT, ACTION_COMPLETE);

    private static final String PARAM_ACTION = "action";
    private static final String PARAM_QUERY = "query";
    private static final String PARAM_IDS = "ids";
    private static final String PARAM_ID = "id";
    private static final String PARAM_CONTENT = "content";
    private static final String PARAM_SUMMARY = "summary";

    private final Agent agent;
    private final String sessionId = UUID.randomUUID().toString();
    private final int maxOperations;
    private final MemoryRepositoryPort memoryRepository;
    private final AgentRepositoryPort agentRepository;
    private final AuditPort auditPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Integer> stats = new LinkedHashMap<>();
    private int operations;
    private boolean completed;

    @SuppressWarnings("java:S107") // session state plus its collaborators, created once per consented refinement
    public RefinementSession(Agent agent, int maxOperations, MemoryRepositoryPort memoryRepository,
            AgentRepositoryPort agentRepository, AuditPort auditPort, ObjectMapper objectMapper, Clock clock) {
        this.agent = agent;
        this.maxOperations = maxOperations;
        this.memoryRepository = memoryRepository;
        this.agentRepository = agentRepository;
        this.auditPort = auditPort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        stats.put("consolidated", 0);
        stats.put("updated", 0);
        stats.put("deleted", 0);
        stats.put("protected", 0);
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_ACTION, Map.of(
                "type", "string",
                "enum", ACTIONS,
                "description", "Refinement action to perform"));
        properties.put(PARAM_QUERY, Map.of("type", "string", "description", "Search text (for search)"));
        properties.put(PARAM_IDS, Map.of("type", "string",
                "description", "Comma-separated memory ids to merge, at least two (for consolidate)"));
        properties.put(PARAM_ID, Map.of("type", "string", "description", "Memory id (for update/delete/protect)"));
        properties.put(PARAM_CONTENT, Map.of("type", "string",
                "description", "New memory text (for consolidate/update)"));
        properties.put(PARAM_SUMMARY, Map.of("type", "string",
                "description", "Brief summary of the session (for complete)"));
        return ToolDefinition.of(TOOL_NAME,
                "Refine your core memories: search, consolidate duplicates, update phrasing, delete exact "
                        + "duplicates, protect a memory as constitutional, complete the session.",
                properties, List.of(PARAM_ACTION));
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        String action = text(parameters, PARAM_ACTION);
        log.info("[Refinement] Agent {}: {}", agent.getId(), action);
        if (action == null || !ACTIONS.contains(action)) {
            return done(error("Invalid action '" + action + "'. Allowed: " + String.join(", ", ACTIONS)));
        }
        if (completed) {
            return done(error("Refinement session already completed"));
        }
        if (isMutating(action) && operations >= maxOperations) {
            return done(error("Operation limit reached (" + maxOperations + "). Call complete to finish."));
        }
        try {
            ToolResult result = switch (action) {
            case ACTION_SEARCH -> search(text(parameters, PARAM_QUERY));
            case ACTION_CONSOLIDATE -> consolidate(text(parameters, PARAM_IDS), text(parameters, PARAM_CONTENT));
            case ACTION_UPDATE -> update(text(parameters, PARAM_ID), text(parameters, PARAM_CONTENT));
            case ACTION_DELETE -> delete(text(parameters, PARAM_ID));
            case ACTION_PROTECT -> protect(text(parameters, PARAM_ID));
            default -> complete(text(parameters, PARAM_SUMMARY));
            };
            if (result.isSuccess() && isMutating(action)) {
                operations++;
            }
            return done(result);
        } catch (RuntimeException e) {
            log.warn("[Refinement] Agent {} action {} failed: {}", agent.getId(), action, e.getMessage());
            return done(error("Refinement action failed: " + e.getMessage()));
        }
    }

    private ToolResult search(String query) {
        if (query == null) {
            return paramError(ACTION_SEARCH, PARAM_QUERY);
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<String> results = ownCore().stream()
                .filter(memory -> memory.getContent().toLowerCase(Locale.ROOT).contains(needle))
                .map(MemoryRefiner::ledgerLine)
                .toList();
        return ok(Map.of("type", "search_results", "query", query, "count", results.size(), "results", results));
    }

    private ToolResult consolidate(String ids, String content) {
        if (ids == null) {
            return paramError(ACTION_CONSOLIDATE, PARAM_IDS);
        }
        if (content == null) {
            return paramError(ACTION_CONSOLIDATE, PARAM_CONTENT);
        }
        List<Long> memoryIds = parseIds(ids);
        if (memoryIds.size() < 2) {
            return error("consolidate requires at least 2 memory IDs");
        }
        List<AgentMemory> memories = ownCore().stream()
                .filter(memory -> memoryIds.contains(memory.getId()))
                .toList();
        if (memories.isEmpty()) {
            return error("No matching memories found");
        }
        List<Long> constitutional = memories.stream()
                .filter(AgentMemory::isConstitutional)
                .map(AgentMemory::getId)
                .toList();
        if (!constitutional.isEmpty()) {
            return error("Cannot consolidate constitutional memories: " + constitutional);
        }

        Instant earliest = memories.stream()
                .map(AgentMemory::getCreatedAt)
                .min(Comparator.naturalOrder())
                .orElse(clock.instant());
        AgentMemory merged = memoryRepository.create(AgentMemory.builder()
                .agentId(agent.getId())
                .memoryType(MemoryType.CORE)
                .content(content.trim())
                .tokenEstimate(TokenEstimator.estimate(content.trim()))
                .createdAt(earliest)
                .build());
        List<Map<String, Object>> sources = new ArrayList<>();
        for (AgentMemory memory : memories) {
            sources.add(Map.of("id", memory.getId(), "content", memory.getContent()));
            memory.setDiscarded(true);
            memoryRepository.update(memory);
        }
        audit("memory_refinement_consolidate", Map.of(
                "operation", ACTION_CONSOLIDATE,
                "merged", sources,
                "result", Map.of("id", merged.getId(), "content", merged.getContent())));
        stats.merge("consolidated", memories.size(), Integer::sum);
        return ok(Map.of("type", "consolidated", "merged_count", memories.size(), "new_content", merged.getContent()));
    }

    private ToolResult update(String id, String content) {
        if (id == null) {
            return paramError(ACTION_UPDATE, PARAM_ID);
        }
        if (content == null) {
            return paramError(ACTION_UPDATE, PARAM_CONTENT);
        }
        Optional<AgentMemory> found = findOwnCore(id);
        if (found.isEmpty()) {
            return error("Memory #" + id + " not found");
        }
        AgentMemory memory = found.get();
        String oldContent = memory.getContent();
        memory.setContent(content.trim());
        memory.setTokenEstimate(TokenEstimator.estimate(memory.getContent()));
        memoryRepository.update(memory);
        auditOperation(ACTION_UPDATE, memory, oldContent, memory.getContent());
        stats.merge("updated", 1, Integer::sum);
        return ok(Map.of("type", "updated", "id", memory.getId(), "content", memory.getContent()));
    }

    private ToolResult delete(String id) {
        if (id == null) {
            return paramError(ACTION_DELETE, PARAM_ID);
        }
        Optional<AgentMemory> found = findOwnCore(id);
        if (found.isEmpty()) {
            return error("Memory #" + id + " not found");
        }
        AgentMemory memory = found.get();
        if (memory.isConstitutional()) {
            return error("Cannot delete constitutional memory #" + id);
        }
        auditOperation(ACTION_DELETE, memory, memory.getContent(), null);
        memory.setDiscarded(true);
        memoryRepository.update(memory);
        stats.merge("deleted", 1, Integer::sum);
        return ok(Map.of("type", "deleted", "id", memory.getId()));
    }

    private ToolResult protect(String id) {
        if (id == null) {
            return paramError(ACTION_PROTECT, PARAM_ID);
        }
        Optional<AgentMemory> found = findOwnCore(id);
        if (found.isEmpty()) {
            return error("Memory #" + id + " not found");
        }
        AgentMemory memory = found.get();
        memory.markConstitutional();
        memoryRepository.update(memory);
        auditOperation(ACTION_PROTECT, memory, null, null);
        stats.merge("protected", 1, Integer::sum);
        return ok(Map.of("type", "protected", "id", memory.getId(), "content", memory.getContent()));
    }

    private ToolResult complete(String summary) {
        if (summary == null) {
            return paramError(ACTION_COMPLETE, PARAM_SUMMARY);
        }
        audit("memory_refinement_complete", Map.of("summary", summary, "stats", Map.copyOf(stats)));
        memoryRepository.create(AgentMemory.builder()
                .agentId(agent.getId())
                .memoryType(MemoryType.JOURNAL)
                .content("Refinement session: " + summary)
                .tokenEstimate(TokenEstimator.estimate(summary))
                .createdAt(clock.instant())
                .build());
        markRefined();
        completed = true;
        return ok(Map.of("type", "refinement_complete", "summary", summary, "stats", Map.copyOf(stats)));
    }

    /**
     * Records the refinement timestamp when the agent ended without calling
     * {@code complete}.
     */
    void closeIfOpen() {
        if (!completed) {
            markRefined();
            completed = true;
        }
    }

    public boolean isCompleted() {
        return completed;
    }

    public int getOperations() {
        return operations;
    }

    public Map<String, Integer> getStats() {
        return Map.copyOf(stats);
    }

    public String getSessionId() {
        return sessionId;
    }

    private void markRefined() {
        agent.setLastRefinementAt(clock.instant());
        agentRepository.save(agent);
    }

    private List<AgentMemory> ownCore() {
        return memoryRepository.findByAgent(agent.getId()).stream()
                .filter(memory -> !memory.isDiscarded())
                .filter(AgentMemory::isCore)
                .sorted(Comparator.comparing(AgentMemory::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    private Optional<AgentMemory> findOwnCore(String id) {
        List<Long> ids = parseIds(id);
        if (ids.size() != 1) {
            return Optional.empty();
        }
        return ownCore().stream().filter(memory -> ids.get(0).equals(memory.getId())).findFirst();
    }

    private void auditOperation(String operation, AgentMemory memory, String before, String after) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        payload.put("memory_id", memory.getId());
        if (before != null) {
            payload.put("before", before);
        }
        if (after != null) {
            payload.put("after", after);
        }
        audit("memory_refinement_" + operation, payload);
    }

    private void audit(String action, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>(data);
        payload.put("session_id", sessionId);
        auditPort.record(AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .accountId(agent.getAccountId())
                .agentId(agent.getId())
                .action(action)
                .payload(payload)
                .createdAt(clock.instant())
                .build());
    }

    private static boolean isMutating(String action) {
        return !ACTION_SEARCH.equals(action) && !ACTION_COMPLETE.equals(action);
    }

    private static List<Long> parseIds(String ids) {
        List<Long> parsed = new ArrayList<>();
        for (String part : ids.split(",")) {
            String trimmed = part.trim().replace("#", "");
            if (trimmed.matches("\\d+")) {
                parsed.add(Long.parseLong(trimmed));
            }
        }
        return parsed;
    }

    private static String text(Map<String, Object> parameters, String key) {
        if (parameters == null) {
            return null;
        }
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        String text = value instanceof List<?> list
                ? String.join(",", list.stream().map(String::valueOf).toList())
                : String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    private ToolResult ok(Map<String, Object> body) {
        try {
            return ToolResult.success(objectMapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            return ToolResult.success(body.toString());
        }
    }

    private static ToolResult paramError(String action, String param) {
        return error(param + " is required for " + action);
    }

    private static ToolResult error(String message) {
        return ToolResult.failure(message);
    }

    private static CompletableFuture<ToolResult> done(ToolResult result) {
        return CompletableFuture.completedFuture(result);
    }
}
