package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.impl.CalculatorTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AnthropicClientTest {

    private static final String URL = "https://anthropic.example.com/v1/messages";

    private MockRestServiceServer server;
    private AnthropicClient client;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("ant-key");
        props.setBaseUrl("https://anthropic.example.com/v1");
        props.setModel("claude-test");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new AnthropicClient(props, new ObjectMapper(), new ImageInliner(), builder);
    }

    @Test
    void chat_liftsSystemPromptAndParsesToolUse() {
        server.expect(requestTo(URL))
                .andExpect(header("x-api-key", "ant-key"))
                .andExpect(header("anthropic-version", AnthropicClient.API_VERSION))
                .andExpect(jsonPath("$.system").value("你是助手"))
                .andExpect(jsonPath("$.messages.length()").value(1))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.tools[0].name").value("calculator"))
                .andExpect(jsonPath("$.tools[0].input_schema.type").value("object"))
                .andRespond(withSuccess("""
                        {"content":[
                           {"type":"text","text":"我来算一下"},
                           {"type":"tool_use","id":"toolu_1","name":"calculator","input":{"expression":"6*7"}}
                         ],
                         "stop_reason":"tool_use",
                         "usage":{"input_tokens":20,"output_tokens":9}}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(
                List.of(Message.system("你是助手"), Message.user("6*7?")),
                List.of(ToolDefinition.from(new CalculatorTool())));

        server.verify();
        assertThat(response.getContent()).isEqualTo("我来算一下");
        assertThat(response.getToolCalls()).hasSize(1);
        ToolCall call = response.getToolCalls().get(0);
        assertThat(call.getId()).isEqualTo("toolu_1");
        assertThat(call.getToolName()).isEqualTo("calculator");
        assertThat(call.getArguments()).isEqualTo("{\"expression\":\"6*7\"}");
        assertThat(response.getFinishReason()).isEqualTo("tool_use");
        assertThat(response.getPromptTokens()).isEqualTo(20);
    }

    @Test
    void chat_consecutiveToolResults_mergedIntoOneUserMessage() {
        ToolCall first = ToolCall.builder().id("t1").toolName("calculator").arguments("{\"expression\":\"1\"}").build();
        ToolCall second = ToolCall.builder().id("t2").toolName("datetime").arguments("{}").build();

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages.length()").value(3))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[1].content[0].type").value("tool_use"))
                .andExpect(jsonPath("$.messages[1].content[0].input.expression").value("1"))
                .andExpect(jsonPath("$.messages[1].content[1].id").value("t2"))
                .andExpect(jsonPath("$.messages[2].role").value("user"))
                .andExpect(jsonPath("$.messages[2].content.length()").value(2))
                .andExpect(jsonPath("$.messages[2].content[0].type").value("tool_result"))
                .andExpect(jsonPath("$.messages[2].content[0].tool_use_id").value("t1"))
                .andExpect(jsonPath("$.messages[2].content[1].tool_use_id").value("t2"))
                .andRespond(withSuccess("""
                        {"content":[{"type":"text","text":"完成"}],"stop_reason":"end_turn"}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(List.of(
                Message.user("算一下再看时间"),
                Message.assistantToolCalls("", List.of(first, second)),
                Message.tool("t1", "calculator", "计算结果: 1 = 1"),
                Message.tool("t2", "datetime", "2024-01-01")), List.of());

        server.verify();
        assertThat(response.getContent()).isEqualTo("完成");
        assertThat(response.hasToolCalls()).isFalse();
    }

    @Test
    void chat_forbidden_raisesConfigurationError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmConfigurationException.class)
                .hasMessageContaining("ANTHROPIC_API_KEY");
    }

    @Test
    void chat_rateLimited_retryableTransportError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOfSatisfying(LlmTransportException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void chat_missingContentBlocks_raisesFormatError() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"id\":\"msg_1\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmResponseFormatException.class);
    }

    @Test
    void chatStream_yieldsTextDeltasUntilMessageStop() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.stream").value(true))
                .andRespond(withSuccess("""
                        event: message_start
                        data: {"type":"message_start","message":{"id":"msg_1"}}

                        event: content_block_delta
                        data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"你"}}

                        event: content_block_delta
                        data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"好"}}

                        event: message_stop
                        data: {"type":"message_stop"}

                        """, MediaType.TEXT_EVENT_STREAM));

        try (Stream<String> deltas = client.chatStream(List.of(Message.system("s"), Message.user("hi")))) {
            assertThat(deltas.toList()).containsExactly("你", "好");
        }
    }
}
