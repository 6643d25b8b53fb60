package me.golemcore.pilot.adapter.outbound.llm;

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
import dev.langchain4j.model.chat.request.ResponseFormat;
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
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.LlmEvent;
import me.golemcore.pilot.domain.model.LlmRequest;
import me.golemcore.pilot.domain.model.LlmUsage;
import me.golemcore.pilot.domain.model.Message;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.model.ToolChoice;
import me.golemcore.pilot.domain.model.ToolDefinition;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic. Models
 * are addressed as {@code provider/model}; credentials come from
 * {@code pilot.llm.providers.<provider>}.
 *
 * <p>
 * A turn is a single blocking chat call run on the bounded elastic scheduler.
 * Its response is replayed as an event stream: text, then every tool execution
 * request as a streaming call followed by the emitted call, then the finish
 * event with token usage. Cancelling the stream drops the pending response.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final PilotProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(PilotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void initialize() {
        String model = properties.getLlm().getModel();
        try {
            modelFor(model);
            log.info("Langchain4j adapter initialized with model: {}", model);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public Flux<LlmEvent> issue(LlmRequest request) {
        return Mono.fromCallable(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
            return chatWithBackoff(modelFor(model), buildChatRequest(request));
        })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(response -> Flux.fromIterable(toEvents(response)));
    }

    @Override
    public CompletableFuture<String> generateStructured(StructuredRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
            ChatResponse response = chatWithBackoff(modelFor(model), buildStructuredRequest(request, model));
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null || text.isBlank()) {
                throw new IllegalStateException("Structured generation returned no content: " + request.getName());
            }
            return text;
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return isAvailable(properties.getLlm().getModel());
    }

    @Override
    public boolean isAvailable(String model) {
        PilotProperties.ProviderProperties config = properties.getLlm().getProviders().get(providerOf(model));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    // ==================== Model creation ====================

    private ChatModel modelFor(String model) {
        return models.computeIfAbsent(model, this::createModel);
    }

    private ChatModel createModel(String model) {
        String provider = providerOf(model);
        PilotProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add pilot.llm.providers." + provider + ".api-key");
        }
        String modelName = stripProviderPrefix(model);
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(4096)
                    .timeout(properties.getLlm().getTimeout());
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }
        // All non-Anthropic providers use OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .timeout(properties.getLlm().getTimeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    static String providerOf(String model) {
        if (model == null || !model.contains("/")) {
            return PROVIDER_OPENAI;
        }
        return model.substring(0, model.indexOf('/'));
    }

    private static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    // ==================== Requests ====================

    private ChatRequest buildChatRequest(LlmRequest request) {
        String systemPrompt = request.getSystemPrompt();
        if (request.getToolChoice() == ToolChoice.SPECIFIC && request.getForcedToolName() != null) {
            // langchain4j has no per-name tool choice: force a call and name the tool
            String pin = "Your next response must be a call to the " + request.getForcedToolName() + " tool.";
            systemPrompt = systemPrompt != null && !systemPrompt.isBlank() ? systemPrompt + "\n\n" + pin : pin;
        }
        List<ChatMessage> messages = convertMessages(systemPrompt, request.getMessages());
        List<ToolSpecification> tools = convertTools(request.getTools());

        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(messages)
                .temperature(request.getTemperature());
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
            builder.toolChoice(request.getToolChoice() == ToolChoice.AUTO
                    ? dev.langchain4j.model.chat.request.ToolChoice.AUTO
                    : dev.langchain4j.model.chat.request.ToolChoice.REQUIRED);
        }
        return builder.build();
    }

    private ChatRequest buildStructuredRequest(StructuredRequest request, String model) {
        List<ChatMessage> messages = new ArrayList<>();
        StringBuilder system = new StringBuilder();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            system.append(request.getSystemPrompt()).append("\n\n");
        }
        system.append("Respond only with a JSON object matching this JSON Schema:\n")
                .append(toJson(request.getSchema()));
        messages.add(SystemMessage.from(system.toString()));
        messages.add(UserMessage.from(request.getPrompt()));

        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(messages)
                .temperature(request.getTemperature());
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        if (!PROVIDER_ANTHROPIC.equals(providerOf(model))) {
            builder.responseFormat(ResponseFormat.JSON);
        }
        return builder.build();
    }

    private ChatResponse chatWithBackoff(ChatModel model, ChatRequest chatRequest) {
        for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
            try {
                return model.chat(chatRequest);
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= MAX_RETRIES) {
                    throw e;
                }
                long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                long resetSeconds = extractResetSeconds(e);
                long backoffMs = resetSeconds > 0
                        ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                        : exponentialBackoffMs;
                log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms{}...",
                        attempt + 1, MAX_RETRIES, backoffMs,
                        resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("LLM call interrupted during retry backoff", ie);
                }
            }
        }
        throw new IllegalStateException("LLM call failed: max retries exhausted");
    }

    private boolean isRateLimitError(Throwable e) {
        // Walk the cause chain looking for rate limit indicators
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("model_cooldown"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extract reset_seconds from a rate limit error body. Returns -1 if not found.
     */
    private long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    // ==================== Conversion ====================

    /**
     * Replays a chat response as turn events.
     */
    List<LlmEvent> toEvents(ChatResponse response) {
        List<LlmEvent> events = new ArrayList<>();
        AiMessage aiMessage = response.aiMessage();
        boolean hasCalls = aiMessage != null && aiMessage.hasToolExecutionRequests();
        if (aiMessage != null && aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            events.add(LlmEvent.textDelta(aiMessage.text()));
        }
        if (hasCalls) {
            for (ToolExecutionRequest ter : aiMessage.toolExecutionRequests()) {
                events.add(LlmEvent.callStreaming(ter.id(), ter.name()));
                events.add(LlmEvent.callEmitted(ter.id(), ter.name(), parseJsonArgs(ter.arguments())));
            }
        }
        events.add(LlmEvent.finish(mapFinishReason(response.finishReason(), hasCalls),
                convertUsage(response.tokenUsage())));
        return events;
    }

    static String mapFinishReason(FinishReason reason, boolean hasCalls) {
        if (reason == null) {
            return hasCalls ? LlmEvent.FINISH_TOOL_CALLS : LlmEvent.FINISH_STOP;
        }
        return switch (reason) {
        case TOOL_EXECUTION -> LlmEvent.FINISH_TOOL_CALLS;
        case LENGTH -> LlmEvent.FINISH_LENGTH;
        case CONTENT_FILTER -> LlmEvent.FINISH_CONTENT_FILTER;
        default -> hasCalls ? LlmEvent.FINISH_TOOL_CALLS : LlmEvent.FINISH_STOP;
        };
    }

    private static LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return LlmUsage.empty();
        }
        int input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        int output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        int total = tokenUsage.totalTokenCount() != null ? tokenUsage.totalTokenCount() : input + output;
        return new LlmUsage(input, output, total);
    }

    private List<ChatMessage> convertMessages(String systemPrompt, List<Message> transcript) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        if (transcript == null) {
            return messages;
        }
        for (Message msg : transcript) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> messages.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(toJson(tc.getArguments()))
                                    .build())
                            .toList();
                    String text = msg.getContent();
                    messages.add(text != null && !text.isBlank()
                            ? AiMessage.from(text, toolRequests)
                            : AiMessage.from(toolRequests));
                } else if (msg.getContent() != null && !msg.getContent().isBlank()) {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            default -> log.warn("Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
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

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");
        boolean described = description != null && !description.isBlank();

        // Enum values take priority
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
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) { // NOSONAR - fall back to an empty object
            log.warn("Failed to serialize to JSON: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (Exception e) { // NOSONAR - invalid arguments are caught by schema validation
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
