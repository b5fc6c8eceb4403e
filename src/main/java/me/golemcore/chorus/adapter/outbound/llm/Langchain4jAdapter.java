package me.golemcore.chorus.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.chorus.domain.component.ToolComponent;
import me.golemcore.chorus.domain.model.LlmEvent;
import me.golemcore.chorus.domain.model.LlmRequest;
import me.golemcore.chorus.domain.model.LlmResponse;
import me.golemcore.chorus.domain.model.LlmUsage;
import me.golemcore.chorus.domain.model.Message;
import me.golemcore.chorus.domain.model.Provider;
import me.golemcore.chorus.domain.model.ProviderSelection;
import me.golemcore.chorus.domain.model.ThinkingConfig;
import me.golemcore.chorus.domain.model.ToolDefinition;
import me.golemcore.chorus.domain.model.ToolResult;
import me.golemcore.chorus.domain.provider.UnsupportedThinkingException;
import me.golemcore.chorus.infrastructure.config.ChorusProperties;
import me.golemcore.chorus.infrastructure.config.ModelRegistryService;
import me.golemcore.chorus.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Anthropic goes through the native Anthropic client. OpenAI, Gemini, xAI and
 * OpenRouter all speak the OpenAI-compatible API and differ only in base URL.
 *
 * <p>
 * Each model reply is emitted as one content delta. Tool calls requested by the
 * model are executed here and fed back until the model answers without tools or
 * the round limit is hit.
 *
 * <p>
 * Configuration via {@code chorus.llm.providers.*} and {@code models.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Map<Provider, String> DEFAULT_BASE_URLS = Map.of(
            Provider.OPENROUTER, "https://openrouter.ai/api/v1",
            Provider.GEMINI, "https://generativelanguage.googleapis.com/v1beta/openai/",
            Provider.XAI, "https://api.x.ai/v1");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ChorusProperties properties;
    private final ModelRegistryService modelRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public Flux<LlmEvent> stream(LlmRequest request) {
        return Flux.create(sink -> {
            try {
                runConversation(request, sink);
                sink.complete();
            } catch (RuntimeException e) {
                log.warn("[LLM] Call to {} via {} failed: {}", request.modelId(), providerOf(request),
                        e.getMessage());
                sink.error(e);
            }
        });
    }

    private void runConversation(LlmRequest request, FluxSink<LlmEvent> sink) {
        ChatModel model = createModel(request);
        List<ChatMessage> messages = convertMessages(request);
        Map<String, ToolComponent> tools = indexTools(request.getTools());
        List<ToolSpecification> specifications = tools.values().stream()
                .map(tool -> convertToolDefinition(tool.getDefinition()))
                .collect(Collectors.toList());
        int maxRounds = properties.getTurn().getMaxToolRounds();

        for (int round = 0;; round++) {
            sink.next(new LlmEvent.NewMessage());
            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!specifications.isEmpty()) {
                chatRequest.toolSpecifications(specifications);
            }
            ChatResponse response = model.chat(chatRequest.build());
            LlmResponse converted = convertResponse(response, request.modelId());

            if (converted.getReasoning() != null && !converted.getReasoning().isEmpty()) {
                sink.next(new LlmEvent.ReasoningDelta(converted.getReasoning()));
            }
            if (converted.getContent() != null && !converted.getContent().isEmpty()) {
                sink.next(new LlmEvent.ContentDelta(converted.getContent()));
            }
            if (converted.hasToolCalls()) {
                converted.getToolCalls().forEach(call -> sink.next(new LlmEvent.ToolCallRequested(call)));
            }
            sink.next(LlmEvent.EndMessage.reply(converted));

            if (!converted.hasToolCalls()) {
                return;
            }
            if (round + 1 >= maxRounds) {
                log.warn("[LLM] Tool round limit ({}) reached for {}", maxRounds, request.modelId());
                return;
            }

            messages.add(response.aiMessage());
            List<String> results = new ArrayList<>();
            for (Message.ToolCall call : converted.getToolCalls()) {
                String result = executeTool(tools.get(call.getName()), call, request);
                messages.add(ToolExecutionResultMessage.from(call.getId(), call.getName(), result));
                results.add(result);
            }
            sink.next(LlmEvent.EndMessage.ofToolResult(LlmResponse.builder()
                    .content(String.join("\n", results))
                    .model(request.modelId())
                    .build()));
        }
    }

    private String executeTool(ToolComponent tool, Message.ToolCall call, LlmRequest request) {
        if (tool == null) {
            return "Error: unknown tool " + call.getName();
        }
        long timeoutMs = properties.getLlm().getRequestTimeout().toMillis();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        try {
            ToolResult result = tool.execute(request.getToolContext(), arguments).get(timeoutMs,
                    TimeUnit.MILLISECONDS);
            return result != null ? result.asModelText() : "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "Error: tool " + call.getName() + " interrupted";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[LLM] Tool {} failed: {}", call.getName(), cause.getMessage());
            return "Error: " + cause.getMessage();
        } catch (TimeoutException e) {
            return "Error: tool " + call.getName() + " timed out";
        }
    }

    @Override
    public ThinkingConfig structuredThinking(ProviderSelection selection, int budgetTokens) {
        if (selection.provider() == Provider.ANTHROPIC
                && modelRegistry.supportsStructuredThinking(selection.logicalModelId())) {
            return ThinkingConfig.builder()
                    .mode(ThinkingConfig.Mode.STRUCTURED_BUDGET)
                    .budgetTokens(budgetTokens)
                    .maxTokens(budgetTokens + properties.getLlm().getThinkingResponseHeadroom())
                    .build();
        }
        throw new UnsupportedThinkingException("No structured thinking for " + selection.logicalModelId()
                + " via " + selection.provider().key());
    }

    @Override
    public boolean isProviderConfigured(Provider provider) {
        ChorusProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider.key());
        return config != null && config.isConfigured();
    }

    @Override
    public void refreshModelRegistry() {
        modelRegistry.reload();
    }

    private ChatModel createModel(LlmRequest request) {
        ProviderSelection selection = request.getProvider();
        if (selection == null) {
            throw new IllegalStateException("No provider selected for request");
        }
        ChorusProperties.ProviderProperties config = getProviderConfig(selection.provider());
        if (selection.provider() == Provider.ANTHROPIC) {
            return createAnthropicModel(request, selection, config);
        }
        return createOpenAiModel(request, selection, config);
    }

    private ChorusProperties.ProviderProperties getProviderConfig(Provider provider) {
        ChorusProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider.key());
        if (config == null || !config.isConfigured()) {
            throw new IllegalStateException("Provider not configured: " + provider.key()
                    + ". Add chorus.llm.providers." + provider.key() + ".api-key");
        }
        return config;
    }

    private ChatModel createAnthropicModel(LlmRequest request, ProviderSelection selection,
            ChorusProperties.ProviderProperties config) {
        ThinkingConfig thinking = request.getThinking();
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(selection.modelId())
                .maxRetries(0) // retries belong to the task queue
                .maxTokens(maxTokens(request))
                .timeout(properties.getLlm().getRequestTimeout());

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }

        if (thinking != null && thinking.budgetTokens() != null) {
            builder.thinkingType("enabled")
                    .thinkingBudgetTokens(thinking.budgetTokens())
                    .returnThinking(true);
            if (thinking.maxTokens() != null) {
                builder.maxTokens(thinking.maxTokens());
            }
        } else if (request.getTemperature() != null && modelRegistry.supportsTemperature(selection.logicalModelId())) {
            builder.temperature(request.getTemperature());
        }

        return builder.build();
    }

    private ChatModel createOpenAiModel(LlmRequest request, ProviderSelection selection,
            ChorusProperties.ProviderProperties config) {
        ThinkingConfig thinking = request.getThinking();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(selection.modelId())
                .maxRetries(0) // retries belong to the task queue
                .timeout(properties.getLlm().getRequestTimeout());

        String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl()
                : DEFAULT_BASE_URLS.get(selection.provider());
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }

        if (thinking != null && thinking.effort() != null) {
            log.debug("[LLM] Using reasoning effort {} for {}", thinking.effort(), selection.modelId());
            builder.reasoningEffort(thinking.effort());
            if (thinking.maxCompletionTokens() != null) {
                builder.maxCompletionTokens(thinking.maxCompletionTokens());
            }
        } else {
            builder.maxCompletionTokens(maxTokens(request));
            if (request.getTemperature() != null && modelRegistry.supportsTemperature(selection.logicalModelId())) {
                builder.temperature(request.getTemperature());
            }
        }

        return builder.build();
    }

    private int maxTokens(LlmRequest request) {
        return request.getMaxTokens() != null ? request.getMaxTokens()
                : properties.getLlm().getDefaultMaxTokens();
    }

    private static String providerOf(LlmRequest request) {
        return request.getProvider() != null ? request.getProvider().provider().key() : "none";
    }

    private static Map<String, ToolComponent> indexTools(List<ToolComponent> tools) {
        Map<String, ToolComponent> index = new LinkedHashMap<>();
        if (tools != null) {
            for (ToolComponent tool : tools) {
                index.put(tool.getToolName(), tool);
            }
        }
        return index;
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String role = msg.getRole() != null ? msg.getRole() : Message.ROLE_USER;
            switch (role) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(textOf(msg)));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(textOf(msg)));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    textOf(msg)));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(textOf(msg)));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", role);
                messages.add(UserMessage.from(textOf(msg)));
            }
            }
        }

        return messages;
    }

    private static String textOf(Message message) {
        return message.getContent() != null ? message.getContent() : "";
    }

    @SuppressWarnings("unchecked") // tool input schemas are JSON-shaped maps
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> schemaProperties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (schemaProperties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : schemaProperties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked") // tool input schemas are JSON-shaped maps
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, String modelId) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(orZero(response.tokenUsage().inputTokenCount()))
                    .outputTokens(orZero(response.tokenUsage().outputTokenCount()))
                    .totalTokens(orZero(response.tokenUsage().totalTokenCount()))
                    .build();
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .reasoning(aiMessage.thinking())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(modelId)
                .finishReason(response.finishReason() != null ? response.finishReason().name()
                        : LlmResponse.FINISH_STOP)
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (Exception e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) {
            log.warn("[LLM] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
