package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.MessageContent;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.impl.CalculatorTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiCompatibleClientTest {

    private static final String URL = "https://llm.example.com/v1/chat/completions";

    @TempDir
    Path dir;

    private MockRestServiceServer server;
    private OpenAiCompatibleClient client;

    @BeforeEach
    void setUp() {
        LlmProviderProperties props = new LlmProviderProperties();
        props.setApiKey("sk-test");
        props.setBaseUrl("https://llm.example.com/v1");
        props.setModel("test-model");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new OpenAiCompatibleClient(LlmProvider.DEEPSEEK, props, new ObjectMapper(), new ImageInliner(), builder);
    }

    @Test
    void chat_sendsToolsAndParsesEveryToolCallInOrder() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.tools[0].type").value("function"))
                .andExpect(jsonPath("$.tools[0].function.name").value("calculator"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andRespond(withSuccess("""
                        {"choices":[{"finish_reason":"tool_calls","message":{"role":"assistant","content":null,
                          "tool_calls":[
                            {"id":"call_1","type":"function","function":{"name":"calculator","arguments":"{\\"expression\\":\\"1+1\\"}"}},
                            {"id":"call_2","type":"function","function":{"name":"datetime","arguments":"{}"}}
                          ]}}],
                         "usage":{"prompt_tokens":12,"completion_tokens":7}}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(
                List.of(Message.system("sys"), Message.user("1+1?")),
                List.of(ToolDefinition.from(new CalculatorTool())));

        server.verify();
        assertThat(response.getContent()).isEmpty();
        assertThat(response.getToolCalls()).extracting(ToolCall::getId).containsExactly("call_1", "call_2");
        assertThat(response.getToolCalls().get(0).getArguments()).isEqualTo("{\"expression\":\"1+1\"}");
        assertThat(response.getPromptTokens()).isEqualTo(12);
        assertThat(response.getCompletionTokens()).isEqualTo(7);
    }

    @Test
    void chat_echoesToolHistoryInWireFormat() {
        ToolCall call = ToolCall.builder().id("call_9").toolName("calculator").arguments("{\"expression\":\"2\"}").build();
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].id").value("call_9"))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].function.arguments").value("{\"expression\":\"2\"}"))
                .andExpect(jsonPath("$.messages[2].role").value("tool"))
                .andExpect(jsonPath("$.messages[2].tool_call_id").value("call_9"))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"content":"2"}}]}
                        """, MediaType.APPLICATION_JSON));

        LlmResponse response = client.chat(List.of(
                Message.user("2?"),
                Message.assistantToolCalls("", List.of(call)),
                Message.tool("call_9", "calculator", "计算结果: 2 = 2")), List.of());

        server.verify();
        assertThat(response.getContent()).isEqualTo("2");
        assertThat(response.hasToolCalls()).isFalse();
    }

    @Test
    void chat_localImage_inlinedAsDataUri() throws Exception {
        Path image = Files.write(dir.resolve("pic.png"), new byte[]{1, 2, 3});
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[0].content[0].type").value("text"))
                .andExpect(jsonPath("$.messages[0].content[1].type").value("image_url"))
                .andExpect(jsonPath("$.messages[0].content[1].image_url.url").value("data:image/png;base64,AQID"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"content":"一只猫"}}]}
                        """, MediaType.APPLICATION_JSON));

        MessageContent content = MessageContent.ofParts(List.of(
                ContentPart.text("这是什么"), ContentPart.image(image.toString())));
        LlmResponse response = client.chat(List.of(Message.user(content)), List.of());

        server.verify();
        assertThat(response.getContent()).isEqualTo("一只猫");
    }

    @Test
    void chat_unauthorized_raisesConfigurationError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmConfigurationException.class)
                .hasMessageContaining("DEEPSEEK_API_KEY");
    }

    @Test
    void chat_serverError_raisesRetryableTransportError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOfSatisfying(LlmTransportException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getProvider()).isEqualTo("deepseek");
                });
    }

    @Test
    void chat_badRequest_notRetryable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .body("{\"error\":\"bad\"}").contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOfSatisfying(LlmTransportException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void chat_noChoices_raisesFormatError() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.chat(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmResponseFormatException.class);
    }

    @Test
    void chatStream_yieldsContentDeltasUntilDone() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.stream").value(true))
                .andRespond(withSuccess("""
                        data: {"choices":[{"delta":{"role":"assistant"}}]}

                        data: {"choices":[{"delta":{"content":"你"}}]}

                        data: {"choices":[{"delta":{"content":"好"}}]}

                        data: [DONE]

                        """, MediaType.TEXT_EVENT_STREAM));

        try (Stream<String> deltas = client.chatStream(List.of(Message.user("hi")))) {
            assertThat(deltas.toList()).containsExactly("你", "好");
        }
    }
}
