package me.golemcore.chorus.tools;

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
import me.golemcore.chorus.domain.model.AgentMemory;
import me.golemcore.chorus.domain.model.MemoryType;
import me.golemcore.chorus.domain.model.ToolDefinition;
import me.golemcore.chorus.domain.model.ToolResult;
import me.golemcore.chorus.domain.service.TokenEstimator;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets an agent write to its own memory during a turn.
 *
 * <p>
 * Journal entries fade after the journal window; core entries are permanent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SaveMemoryTool implements ToolComponent {

    public static final String TOOL_NAME = "save_memory";

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final MemoryRepositoryPort memoryRepository;
    private final ChorusProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Save a memory. Journal entries fade after about a week; core memories become "
                        + "part of your permanent identity. Use core sparingly.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "content", Map.of(
                                        "type", "string",
                                        "description", "What to remember, written in first person"),
                                "memory_type", Map.of(
                                        "type", "string",
                                        "enum", List.of("journal", "core"),
                                        "description", "journal (fading) or core (permanent)")),
                        "required", List.of("content", "memory_type")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolContext context, Map<String, Object> parameters) {
        if (context == null || context.agentId() == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No current agent"));
        }
        Object rawContent = parameters.get("content");
        String content = rawContent != null ? rawContent.toString().trim() : "";
        if (content.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure("content is required"));
        }
        Object rawType = parameters.get("memory_type");
        MemoryType type = parseType(rawType);
        if (type == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Invalid memory_type '" + rawType + "'. Use journal or core."));
        }

        Instant now = clock.instant();
        AgentMemory memory = memoryRepository.create(AgentMemory.builder()
                .agentId(context.agentId())
                .memoryType(type)
                .content(content)
                .tokenEstimate(TokenEstimator.estimate(content))
                .createdAt(now)
                .build());
        log.debug("[Memory] Agent {} saved {} memory #{}", context.agentId(), type.wireName(), memory.getId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("memory_type", type.wireName());
        body.put("content", content);
        if (type == MemoryType.JOURNAL) {
            body.put("expires_around", DAY.format(now.plus(properties.getMemory().getJournalWindow())));
        } else {
            body.put("note", "This memory is now part of your permanent identity");
        }
        return CompletableFuture.completedFuture(ToolResult.success(toJson(body)));
    }

    private static MemoryType parseType(Object raw) {
        if (raw == null) {
            return null;
        }
        for (MemoryType type : MemoryType.values()) {
            if (type.wireName().equals(raw.toString().trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return null;
    }

    private String toJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return body.toString();
        }
    }
}
