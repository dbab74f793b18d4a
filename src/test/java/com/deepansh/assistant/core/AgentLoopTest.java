package com.deepansh.assistant.core;

import com.deepansh.assistant.config.AgentProperties;
import com.deepansh.assistant.llm.LlmClient;
import com.deepansh.assistant.llm.LlmClientFactory;
import com.deepansh.assistant.llm.LlmProvider;
import com.deepansh.assistant.llm.LlmTransportException;
import com.deepansh.assistant.memory.MemoryExtractionService;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.model.ChatResponse;
import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.multimodal.MultimodalContentBuilder;
import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.ToolRegistry;
import com.deepansh.assistant.tool.impl.CalculatorTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.nullable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentLoopTest {

    @Mock LlmClientFactory llmClientFactory;
    @Mock MemoryManager memoryManager;
    @Mock MemoryExtractionService memoryExtractionService;

    @TempDir
    Path tempDir;

    private ScriptedClient client;
    private ToolRegistry toolRegistry;
    private AgentProperties properties;
    private AgentLoop agentLoop;
    private ConversationContext context;

    @BeforeEach
    void setUp() {
        client = new ScriptedClient();
        lenient().when(llmClientFactory.getClient(nullable(String.class))).thenReturn(client);

        toolRegistry = new ToolRegistry(new ObjectMapper(), List.of(new CalculatorTool()));
        properties = new AgentProperties();
        agentLoop = new AgentLoop(llmClientFactory, toolRegistry, memoryManager, memoryExtractionService,
                new MultimodalContentBuilder(), properties);
        context = new ConversationContext("s-1", "You are helpful.");
    }

    @Test
    void chat_calculatorRound_recordsRequestResultAndReply() {
        client.script = n -> n == 1
                ? toolCalls(call("call_1", "calculator", "{\"expression\":\"2+2\"}"))
                : text("4");

        ChatResponse response = agentLoop.chat(context, "What is 2+2?", null, null);

        assertThat(response.getReply()).isEqualTo("4");
        assertThat(response.getToolRounds()).isEqualTo(1);
        assertThat(response.isMaxIterationsReached()).isFalse();

        List<Message> history = context.history();
        assertThat(history).extracting(Message::getRole).containsExactly(
                Message.Role.user, Message.Role.assistant, Message.Role.tool, Message.Role.assistant);
        assertThat(history.get(1).getToolCalls()).extracting(ToolCall::getId).containsExactly("call_1");
        assertThat(history.get(2).getToolCallId()).isEqualTo("call_1");
        assertThat(history.get(2).getContent()).isEqualTo("计算结果: 2+2 = 4");
        assertThat(history.get(3).getContent()).isEqualTo("4");
        assertThat(context.messages()).hasSize(5);
    }

    @Test
    void chat_modelAlwaysRequestsTools_stopsAtIterationCeiling() {
        client.script = n -> toolCalls(call("call_" + n, "calculator", "{\"expression\":\"1+1\"}"));

        ChatResponse response = agentLoop.chat(context, "loop forever", null, null);

        assertThat(response.getToolRounds()).isEqualTo(5);
        assertThat(response.isMaxIterationsReached()).isTrue();
        assertThat(client.requests).hasSize(6);
        assertThat(response.getReply()).isEqualTo(properties.getFallbackReply());
        assertThat(context.history()).hasSize(12);
    }

    @Test
    void chat_multipleToolCalls_executedInEmissionOrder() {
        client.script = n -> n == 1
                ? toolCalls(
                        call("call_a", "calculator", "{\"expression\":\"1+1\"}"),
                        call("call_b", "calculator", "{\"expression\":\"2*3\"}"))
                : text("done");
        List<String> observed = new ArrayList<>();
        ToolCallListener listener = new ToolCallListener() {
            @Override
            public void onToolCall(String toolName, String arguments) {
                observed.add("call:" + arguments);
            }

            @Override
            public void onToolResult(String toolName, String result) {
                observed.add("result:" + result);
            }
        };

        ChatResponse response = agentLoop.chat(context, "two sums", null, listener);

        List<Message> history = context.history();
        assertThat(history.get(2).getToolCallId()).isEqualTo("call_a");
        assertThat(history.get(3).getToolCallId()).isEqualTo("call_b");
        assertThat(history.get(3).getContent()).isEqualTo("计算结果: 2*3 = 6");
        assertThat(response.getToolCallsExecuted()).extracting(ToolCall::getId).containsExactly("call_a", "call_b");
        assertThat(observed).containsExactly(
                "call:{\"expression\":\"1+1\"}", "result:计算结果: 1+1 = 2",
                "call:{\"expression\":\"2*3\"}", "result:计算结果: 2*3 = 6");
    }

    @Test
    void chat_unknownTool_errorStringGoesBackToModel() {
        client.script = n -> n == 1 ? toolCalls(call("call_x", "teleport", "{}")) : text("sorry");

        agentLoop.chat(context, "beam me up");

        assertThat(context.history().get(2).getContent()).isEqualTo("错误: 工具 'teleport' 不存在");
        assertThat(client.requests.get(1)).extracting(Message::getRole).endsWith(Message.Role.tool);
    }

    @Test
    void chat_failingListener_doesNotFailTurn() {
        client.script = n -> n == 1 ? toolCalls(call("call_1", "calculator", "{\"expression\":\"3\"}")) : text("3");
        ToolCallListener listener = new ToolCallListener() {
            @Override
            public void onToolCall(String toolName, String arguments) {
                throw new IllegalStateException("listener broke");
            }
        };

        assertThat(agentLoop.chat(context, "three", null, listener).getReply()).isEqualTo("3");
    }

    @Test
    void chat_plainReply_triggersMemoryCapture() {
        client.script = n -> text("好的，小明");

        String reply = agentLoop.chat(context, "我叫小明，我喜欢爬山");

        assertThat(reply).isEqualTo("好的，小明");
        assertThat(context.history()).extracting(Message::getContent)
                .containsExactly("我叫小明，我喜欢爬山", "好的，小明");
        verify(memoryExtractionService).extractAndStore("我叫小明，我喜欢爬山", "好的，小明");
    }

    @Test
    void chat_recalledMemories_appendedToSystemPromptOncePerTurn() {
        when(memoryManager.formatForContext(anyString(), eq(5))).thenReturn("[用户相关记忆]\n- [user_info] 我叫小明");
        client.script = n -> n == 1 ? toolCalls(call("call_1", "calculator", "{\"expression\":\"1\"}")) : text("ok");

        agentLoop.chat(context, "who am I");

        assertThat(client.requests).hasSize(2);
        for (List<Message> request : client.requests) {
            assertThat(request.get(0).getRole()).isEqualTo(Message.Role.system);
            assertThat(request.get(0).getContent())
                    .isEqualTo("You are helpful.\n\n[用户相关记忆]\n- [user_info] 我叫小明");
        }
        verify(memoryManager, times(1)).formatForContext(anyString(), anyInt());
    }

    @Test
    void chat_memoryDisabled_skipsRecallAndCapture() {
        properties.getMemory().setEnabled(false);
        client.script = n -> text("hi");

        agentLoop.chat(context, "hello");

        verifyNoInteractions(memoryManager, memoryExtractionService);
        assertThat(client.requests.get(0).get(0).getContent()).isEqualTo("You are helpful.");
    }

    @Test
    void chat_toolsDisabled_sendsNoToolDefinitions() {
        properties.setToolsEnabled(false);
        client.script = n -> text("hi");

        agentLoop.chat(context, "hello");

        assertThat(client.toolLists.get(0)).isEmpty();
    }

    @Test
    void chat_historyLimit_sendsOnlyRecentMessages() {
        properties.setHistoryLimit(2);
        context.append(Message.user("first"));
        context.append(Message.assistant("first reply"));
        context.append(Message.user("second"));
        context.append(Message.assistant("second reply"));
        client.script = n -> text("third reply");

        agentLoop.chat(context, "third");

        assertThat(client.requests.get(0)).extracting(Message::getContent)
                .containsExactly("You are helpful.", "second reply", "third");
    }

    @Test
    void chat_resetDuringTurn_discardsPendingAppends() {
        client.script = n -> {
            context.reset();
            return toolCalls(call("call_1", "calculator", "{\"expression\":\"1+1\"}"));
        };

        ChatResponse response = agentLoop.chat(context, "hello", null, null);

        assertThat(response.isDiscarded()).isTrue();
        assertThat(context.messages()).hasSize(1);
        assertThat(context.messages().get(0).getContent()).isEqualTo("You are helpful.");
        verify(memoryExtractionService, never()).extractAndStore(anyString(), anyString());
    }

    @Test
    void chat_providerFailure_propagates() {
        client.script = n -> {
            throw new LlmTransportException("openai", "HTTP 500", true);
        };

        assertThatThrownBy(() -> agentLoop.chat(context, "hello"))
                .isInstanceOf(LlmTransportException.class);
    }

    @Test
    void chat_inlineMarkerForMissingFile_degradesToTextNote() {
        client.script = n -> text("ok");

        agentLoop.chat(context, "看看这个 [image:/no/such.png]");

        Message user = context.history().get(0);
        assertThat(user.isMultimodal()).isFalse();
        assertThat(user.getContent()).isEqualTo("看看这个\n[注意: 图片文件不存在: /no/such.png]");
    }

    @Test
    void chat_explicitImagePath_winsOverInlineMarker() throws Exception {
        Path image = Files.write(tempDir.resolve("cat.png"), new byte[]{1, 2});
        client.script = n -> text("a cat");

        agentLoop.chat(context, "what is this <image:/other.png>", image.toString(), null);

        Message user = context.history().get(0);
        assertThat(user.isMultimodal()).isTrue();
        assertThat(user.getParts()).extracting(ContentPart::getType)
                .containsExactly(ContentPart.Type.text, ContentPart.Type.image);
        assertThat(user.getParts().get(0).getText()).isEqualTo("what is this");
        assertThat(user.getParts().get(1).getImageUrl()).isEqualTo(image.toString());
    }

    @Test
    void streamChat_forwardsDeltasAndRecordsReply() {
        client.deltas = List.of("你", "好");
        List<String> received = new ArrayList<>();

        ChatResponse response = agentLoop.streamChat(context, "hi", received::add);

        assertThat(received).containsExactly("你", "好");
        assertThat(response.getReply()).isEqualTo("你好");
        assertThat(context.history()).extracting(Message::getContent).containsExactly("hi", "你好");
    }

    @Test
    void chat_turnCountTracked() {
        client.script = n -> text("ok");

        agentLoop.chat(context, "one");
        agentLoop.chat(context, "two");

        assertThat(context.getMetadata()).containsEntry("turnCount", 2);
    }

    private static ToolCall call(String id, String name, String arguments) {
        return ToolCall.builder().id(id).toolName(name).arguments(arguments).build();
    }

    private static LlmResponse toolCalls(ToolCall... calls) {
        return LlmResponse.builder().content("").toolCalls(List.of(calls)).promptTokens(10).completionTokens(5).build();
    }

    private static LlmResponse text(String content) {
        return LlmResponse.builder().content(content).promptTokens(10).completionTokens(5).build();
    }

    /** Returns scripted responses keyed by the 1-based call number. */
    static class ScriptedClient implements LlmClient {

        final List<List<Message>> requests = new ArrayList<>();
        final List<List<ToolDefinition>> toolLists = new ArrayList<>();
        Function<Integer, LlmResponse> script = n -> text("");
        List<String> deltas = List.of();

        @Override
        public LlmProvider provider() {
            return LlmProvider.OPENAI;
        }

        @Override
        public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
            requests.add(List.copyOf(messages));
            toolLists.add(tools);
            return script.apply(requests.size());
        }

        @Override
        public Stream<String> chatStream(List<Message> messages) {
            requests.add(List.copyOf(messages));
            return deltas.stream();
        }
    }
}
