package me.golemcore.pragent.adapter.outbound.llm;

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

import me.golemcore.pragent.domain.model.LlmRequest;
import me.golemcore.pragent.domain.model.LlmResponse;
import me.golemcore.pragent.domain.model.Message;
import me.golemcore.pragent.domain.model.ToolDefinition;
import me.golemcore.pragent.infrastructure.config.AgentProperties;
import me.golemcore.pragent.port.outbound.LlmPort;
import com.fasterxml.jackson.core.JsonProcessingException;
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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports Anthropic models and any OpenAI-compatible endpoint (OpenAI,
 * Cloudflare Workers AI, local gateways). Model ids have the form
 * {@code <provider>/<model>}; the provider selects the
 * {@code agent.llm.providers.<provider>} credentials.
 *
 * <p>
 * The adapter performs no retries of its own: langchain4j retries are disabled
 * and transient failures are handled by
 * {@link me.golemcore.pragent.domain.system.RetryingLlmPort}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_DESCRIPTION = "description";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getPrimaryModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            ChatRequest chatRequest = buildChatRequest(request);

            try {
                log.trace("[LLM] Calling {} with {} tools", model, request.hasTools() ? request.getTools().size() : 0);
                return convertResponse(chatModel.chat(chatRequest), model);
            } catch (RuntimeException e) {
                log.warn("[LLM] Call to {} failed: {}", model, e.getMessage());
                throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Per-request {@code maxTokens} and {@code temperature} override the model
     * defaults; unset values keep them.
     */
    ChatRequest buildChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(request))
                .maxOutputTokens(request.getMaxTokens())
                .temperature(request.getTemperature());
        List<ToolSpecification> tools = convertTools(request);
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
        }
        return builder.build();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    private ChatModel createModel(String model) {
        String provider = model.contains("/") ? model.substring(0, model.indexOf('/')) : model;
        String modelName = model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
        AgentProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add agent.llm.providers." + provider + ".api-key");
        }
        log.info("[LLM] Creating model {} (provider {})", modelName, provider);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(modelName, config);
        }
        return createOpenAiModel(modelName, config);
    }

    private ChatModel createAnthropicModel(String modelName, AgentProperties.ProviderProperties config) {
        AgentProperties.LlmProperties llm = properties.getLlm();
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by RetryingLlmPort
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(String modelName, AgentProperties.ProviderProperties config) {
        AgentProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by RetryingLlmPort
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    content));
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("[LLM] Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return Collections.emptyList();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null) {
            Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            if (props != null) {
                for (Map.Entry<String, Object> entry : props.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get(SCHEMA_KEY_DESCRIPTION);
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues)
                    .description(description)
                    .build();
        }

        switch (type) {
        case "integer" -> {
            return JsonIntegerSchema.builder().description(description).build();
        }
        case "number" -> {
            return JsonNumberSchema.builder().description(description).build();
        }
        case "boolean" -> {
            return JsonBooleanSchema.builder().description(description).build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nestedProps = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nestedProps.entrySet()) {
                    builder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            List<String> required = (List<String>) paramSchema.get("required");
            if (required != null && !required.isEmpty()) {
                builder.required(required);
            }
            return builder.build();
        }
        default -> {
            return JsonStringSchema.builder().description(description).build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id() != null ? ter.id() : "call_" + UUID.randomUUID())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .rawArguments(ter.arguments())
                            .build())
                    .toList();
            log.trace("[LLM] Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private String convertArgsToJson(Message.ToolCall toolCall) {
        if (toolCall.getArguments() != null) {
            try {
                return objectMapper.writeValueAsString(toolCall.getArguments());
            } catch (JsonProcessingException e) {
                log.warn("[LLM] Failed to serialize tool arguments: {}", e.getMessage());
            }
        }
        return toolCall.getRawArguments() != null ? toolCall.getRawArguments() : "{}";
    }

    /**
     * Returns {@code null} when the provider sent something other than a JSON
     * object; callers fall back to the raw text.
     */
    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.debug("[LLM] Tool arguments are not a JSON object: {}", e.getMessage());
            return null;
        }
    }
}
