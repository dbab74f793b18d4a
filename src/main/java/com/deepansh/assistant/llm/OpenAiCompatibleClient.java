package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Client for the OpenAI chat-completions wire format, shared by OpenAI,
 * DeepSeek, Zhipu and Qwen (compatible mode).
 *
 * The system prompt travels as the first message. Every tool call in the
 * response is returned, in emission order, with its arguments left as the
 * raw JSON text the model produced.
 */
@Slf4j
public class OpenAiCompatibleClient implements LlmClient {

    private final LlmProvider provider;
    private final LlmProviderProperties props;
    private final ObjectMapper objectMapper;
    private final ImageInliner imageInliner;
    private final RestClient restClient;

    public OpenAiCompatibleClient(LlmProvider provider,
                                  LlmProviderProperties props,
                                  ObjectMapper objectMapper,
                                  ImageInliner imageInliner,
                                  RestClient.Builder restClientBuilder) {
        this.provider = provider;
        this.props = props;
        this.objectMapper = objectMapper;
        this.imageInliner = imageInliner;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmProvider provider() {
        return provider;
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = buildRequestBody(messages, tools);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                messages.size(), tools != null ? tools.size() : 0, provider.id(), props.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw ProviderErrors.fromResponse(provider, res);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new LlmTransportException(provider.id(),
                    provider.id() + " is unreachable: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new LlmResponseFormatException(provider.id(),
                    provider.id() + " returned an unreadable response: " + e.getMessage(), e);
        }

        return parseResponse(response);
    }

    @Override
    public Stream<String> chatStream(List<Message> messages) {
        Map<String, Object> requestBody = buildRequestBody(messages, List.of());
        requestBody.put("stream", true);

        log.debug("Streaming {} messages from {} [model={}]", messages.size(), provider.id(), props.getModel());

        try {
            return restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .exchange((req, res) -> {
                        if (res.getStatusCode().isError()) {
                            try (res) {
                                throw ProviderErrors.fromResponse(provider, res);
                            }
                        }
                        return ServerSentEvents.dataPayloads(res)
                                .map(this::deltaText)
                                .filter(delta -> !delta.isEmpty());
                    }, false);
        } catch (ResourceAccessException e) {
            throw new LlmTransportException(provider.id(),
                    provider.id() + " is unreachable: " + e.getMessage(), true, e);
        }
    }

    Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("messages", formattedMessages);

        if (tools != null && !tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }

        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            if (msg.getName() != null) {
                m.put("name", msg.getName());
            }
            m.put("content", msg.textContent());
        } else if (msg.getRole() == Message.Role.assistant && msg.hasToolCalls()) {
            m.put("content", msg.textContent());
            m.put("tool_calls", msg.getToolCalls().stream()
                    .map(this::formatToolCall)
                    .toList());
        } else if (msg.isMultimodal()) {
            m.put("content", msg.getParts().stream().map(this::formatPart).toList());
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new LinkedHashMap<>();
        fn.put("name", tc.getToolName());
        fn.put("arguments", tc.getArguments() != null ? tc.getArguments() : "{}");

        Map<String, Object> tcMap = new LinkedHashMap<>();
        tcMap.put("id", tc.getId());
        tcMap.put("type", "function");
        tcMap.put("function", fn);
        return tcMap;
    }

    private Map<String, Object> formatPart(ContentPart part) {
        if (part.getType() == ContentPart.Type.text) {
            return Map.of("type", "text", "text", part.getText() != null ? part.getText() : "");
        }
        try {
            String url = imageInliner.resolve(part.getImageUrl()).toDataUri();
            return Map.of("type", "image_url", "image_url", Map.of("url", url));
        } catch (IOException e) {
            log.warn("Image [{}] could not be inlined for {}: {}", part.getImageUrl(), provider.id(), e.getMessage());
            return Map.of("type", "text", "text", "[图片无法读取: " + part.getImageUrl() + "]");
        }
    }

    @SuppressWarnings("unchecked")
    LlmResponse parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new LlmResponseFormatException(provider.id(), provider.id() + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmResponseFormatException(provider.id(), provider.id() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = asInt(usage.get("prompt_tokens"));
            completionTokens = asInt(usage.get("completion_tokens"));
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> choice       = choices.get(0);
        Map<String, Object> message      = (Map<String, Object>) choice.get("message");
        String              finishReason = (String) choice.get("finish_reason");

        if (message == null) {
            throw new LlmResponseFormatException(provider.id(), provider.id() + " choice has no message");
        }
        log.debug("{} finish_reason: {}", provider.id(), finishReason);

        List<ToolCall> toolCalls = new ArrayList<>();
        List<Map<String, Object>> rawToolCalls = (List<Map<String, Object>>) message.get("tool_calls");
        if (rawToolCalls != null) {
            for (Map<String, Object> raw : rawToolCalls) {
                toolCalls.add(toToolCall(raw));
            }
        }

        return LlmResponse.builder()
                .content(message.get("content") instanceof String text ? text : "")
                .toolCalls(toolCalls)
                .finishReason(finishReason)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolCall toToolCall(Map<String, Object> raw) {
        Map<String, Object> function = (Map<String, Object>) raw.get("function");
        if (function == null || function.get("name") == null) {
            throw new LlmResponseFormatException(provider.id(), provider.id() + " tool call without a function name");
        }

        Object rawArguments = function.get("arguments");
        String arguments;
        if (rawArguments == null) {
            arguments = "{}";
        } else if (rawArguments instanceof String text) {
            arguments = text;
        } else {
            try {
                arguments = objectMapper.writeValueAsString(rawArguments);
            } catch (JsonProcessingException e) {
                throw new LlmResponseFormatException(provider.id(), "Failed to serialize tool arguments", e);
            }
        }

        String id = (String) raw.get("id");
        return ToolCall.builder()
                .id(id != null && !id.isBlank() ? id : "call_" + UUID.randomUUID().toString().substring(0, 8))
                .toolName((String) function.get("name"))
                .arguments(arguments)
                .build();
    }

    private String deltaText(String payload) {
        try {
            JsonNode delta = objectMapper.readTree(payload).path("choices").path(0).path("delta");
            JsonNode content = delta.path("content");
            return content.isTextual() ? content.asText() : "";
        } catch (JsonProcessingException e) {
            throw new LlmResponseFormatException(provider.id(), "Unreadable stream chunk from " + provider.id(), e);
        }
    }

    private static int asInt(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
