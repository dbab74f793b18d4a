package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Client for the Anthropic Messages API.
 *
 * Differences from the OpenAI family that this class absorbs:
 * - system messages are lifted out of the list into the {@code system} field
 * - tools are declared as {@code {name, description, input_schema}}
 * - tool requests are {@code tool_use} blocks whose input is an object, so it is
 *   re-serialized to JSON text for the canonical {@link ToolCall}
 * - tool results go back as {@code tool_result} blocks inside a user message;
 *   consecutive results are merged into one message
 */
@Slf4j
public class AnthropicClient implements LlmClient {

    static final String API_VERSION = "2023-06-01";

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final ImageInliner imageInliner;
    private final RestClient restClient;

    public AnthropicClient(LlmProviderProperties props,
                           ObjectMapper objectMapper,
                           ImageInliner imageInliner,
                           RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.imageInliner = imageInliner;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("x-api-key", props.getApiKey())
                .defaultHeader("anthropic-version", API_VERSION)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmProvider provider() {
        return LlmProvider.ANTHROPIC;
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages and {} tools to anthropic [model={}]",
                messages.size(), tools != null ? tools.size() : 0, props.getModel());

        String response;
        try {
            response = restClient.post()
                    .uri("/messages")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw ProviderErrors.fromResponse(LlmProvider.ANTHROPIC, res);
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new LlmTransportException(provider().id(), "anthropic is unreachable: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new LlmResponseFormatException(provider().id(),
                    "anthropic returned an unreadable response: " + e.getMessage(), e);
        }

        return parseResponse(response);
    }

    @Override
    public Stream<String> chatStream(List<Message> messages) {
        Map<String, Object> requestBody = buildRequestBody(messages, List.of());
        requestBody.put("stream", true);

        try {
            return restClient.post()
                    .uri("/messages")
                    .body(requestBody)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            try (res) {
                                throw ProviderErrors.fromResponse(LlmProvider.ANTHROPIC, res);
                            }
                        }
                        return ServerSentEvents.dataPayloads(res)
                                .map(this::readEvent)
                                .takeWhile(event -> !"message_stop".equals(event.path("type").asText()))
                                .map(this::deltaText)
                                .filter(delta -> !delta.isEmpty());
                    }, false);
        } catch (ResourceAccessException e) {
            throw new LlmTransportException(provider().id(), "anthropic is unreachable: " + e.getMessage(), true, e);
        }
    }

    Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        String system = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::textContent)
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining("\n\n"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        body.put("messages", formatMessages(messages));

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toAnthropicSchema).toList());
        }
        return body;
    }

    private List<Map<String, Object>> formatMessages(List<Message> messages) {
        List<Map<String, Object>> formatted = new ArrayList<>();
        List<Map<String, Object>> pendingResults = new ArrayList<>();

        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.system) {
                continue;
            }
            if (msg.getRole() == Message.Role.tool) {
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("type", "tool_result");
                result.put("tool_use_id", msg.getToolCallId());
                result.put("content", msg.textContent());
                pendingResults.add(result);
                continue;
            }
            flushToolResults(formatted, pendingResults);

            Map<String, Object> m = new LinkedHashMap<>();
            m.put("role", msg.getRole().name());
            if (msg.getRole() == Message.Role.assistant && msg.hasToolCalls()) {
                List<Map<String, Object>> blocks = new ArrayList<>();
                String text = msg.textContent();
                if (!text.isBlank()) {
                    blocks.add(Map.of("type", "text", "text", text));
                }
                msg.getToolCalls().forEach(tc -> blocks.add(toolUseBlock(tc)));
                m.put("content", blocks);
            } else if (msg.isMultimodal()) {
                m.put("content", msg.getParts().stream().map(this::formatPart).toList());
            } else {
                m.put("content", msg.getContent() != null ? msg.getContent() : "");
            }
            formatted.add(m);
        }
        flushToolResults(formatted, pendingResults);
        return formatted;
    }

    private void flushToolResults(List<Map<String, Object>> formatted, List<Map<String, Object>> pendingResults) {
        if (pendingResults.isEmpty()) {
            return;
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", "user");
        m.put("content", List.copyOf(pendingResults));
        formatted.add(m);
        pendingResults.clear();
    }

    private Map<String, Object> toolUseBlock(ToolCall tc) {
        Map<String, Object> input;
        try {
            String raw = tc.getArguments();
            input = raw == null || raw.isBlank() ? Map.of() : objectMapper.readValue(raw, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Tool call [{}] has unparseable arguments, sending empty input", tc.getId());
            input = Map.of();
        }
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "tool_use");
        block.put("id", tc.getId());
        block.put("name", tc.getToolName());
        block.put("input", input != null ? input : Map.of());
        return block;
    }

    private Map<String, Object> formatPart(ContentPart part) {
        if (part.getType() == ContentPart.Type.text) {
            return Map.of("type", "text", "text", part.getText() != null ? part.getText() : "");
        }
        try {
            ImageInliner.InlineImage image = imageInliner.resolve(part.getImageUrl());
            Map<String, Object> source = image.isRemote()
                    ? Map.of("type", "url", "url", image.url())
                    : Map.of("type", "base64", "media_type", image.mediaType(), "data", image.base64Data());
            return Map.of("type", "image", "source", source);
        } catch (IOException e) {
            log.warn("Image [{}] could not be inlined for anthropic: {}", part.getImageUrl(), e.getMessage());
            return Map.of("type", "text", "text", "[图片无法读取: " + part.getImageUrl() + "]");
        }
    }

    LlmResponse parseResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new LlmResponseFormatException(provider().id(), "anthropic returned malformed JSON", e);
        }
        JsonNode content = root == null ? null : root.path("content");
        if (content == null || !content.isArray()) {
            throw new LlmResponseFormatException(provider().id(), "anthropic response has no content blocks");
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : content) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                text.append(block.path("text").asText(""));
            } else if ("tool_use".equals(type)) {
                toolCalls.add(ToolCall.builder()
                        .id(block.path("id").asText())
                        .toolName(block.path("name").asText())
                        .arguments(block.has("input") ? block.get("input").toString() : "{}")
                        .build());
            }
        }

        JsonNode usage = root.path("usage");
        int promptTokens = usage.path("input_tokens").asInt(0);
        int completionTokens = usage.path("output_tokens").asInt(0);
        log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);

        return LlmResponse.builder()
                .content(text.toString())
                .toolCalls(toolCalls)
                .finishReason(root.path("stop_reason").asText(null))
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    private JsonNode readEvent(String payload) {
        try {
            JsonNode event = objectMapper.readTree(payload);
            if ("error".equals(event.path("type").asText())) {
                throw new LlmTransportException(provider().id(),
                        "anthropic stream error: " + event.path("error").path("message").asText(), false);
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new LlmResponseFormatException(provider().id(), "Unreadable stream event from anthropic", e);
        }
    }

    private String deltaText(JsonNode event) {
        if (!"content_block_delta".equals(event.path("type").asText())) {
            return "";
        }
        JsonNode delta = event.path("delta");
        return "text_delta".equals(delta.path("type").asText()) ? delta.path("text").asText("") : "";
    }
}
