package com.deepansh.assistant.core;

import com.deepansh.assistant.config.AgentProperties;
import com.deepansh.assistant.llm.LlmClient;
import com.deepansh.assistant.llm.LlmClientFactory;
import com.deepansh.assistant.memory.MemoryExtractionService;
import com.deepansh.assistant.memory.MemoryItem;
import com.deepansh.assistant.memory.MemoryManager;
import com.deepansh.assistant.memory.MemoryType;
import com.deepansh.assistant.model.ChatResponse;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.MessageContent;
import com.deepansh.assistant.model.ToolCall;
import com.deepansh.assistant.multimodal.MultimodalContentBuilder;
import com.deepansh.assistant.observability.RunContext;
import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Drives one user turn through the model and the tools.
 *
 * Per-turn flow:
 * 1. Build the user content (inline image marker, file check) and append it
 * 2. Recall memories relevant to the user text
 * 3. Request = system prompt (+ memory block) + the most recent history
 * 4. While the model asks for tools and fewer than the allowed rounds ran:
 *    append the assistant tool-call message, run each tool in emission order,
 *    append one tool message per call, ask the model again
 * 5. Append the final assistant reply (fallback text when empty)
 * 6. Async: capture memorable fragments of the user text
 *
 * Tool errors come back from the registry as text and stay in the conversation.
 * Provider errors propagate and fail the turn. If the conversation is reset
 * while a turn runs, the turn's remaining appends are dropped.
 */
@Service
@Slf4j
public class AgentLoop {

    private final LlmClientFactory llmClientFactory;
    private final ToolRegistry toolRegistry;
    private final MemoryManager memoryManager;
    private final MemoryExtractionService memoryExtractionService;
    private final MultimodalContentBuilder contentBuilder;
    private final AgentProperties properties;

    public AgentLoop(LlmClientFactory llmClientFactory,
                     ToolRegistry toolRegistry,
                     MemoryManager memoryManager,
                     MemoryExtractionService memoryExtractionService,
                     MultimodalContentBuilder contentBuilder,
                     AgentProperties properties) {
        this.llmClientFactory = llmClientFactory;
        this.toolRegistry = toolRegistry;
        this.memoryManager = memoryManager;
        this.memoryExtractionService = memoryExtractionService;
        this.contentBuilder = contentBuilder;
        this.properties = properties;
    }

    /** Runs a turn without image or listener and returns only the reply text. */
    public String chat(ConversationContext context, String userInput) {
        return chat(context, userInput, null, ToolCallListener.NONE).getReply();
    }

    public ChatResponse chat(ConversationContext context,
                             String userInput,
                             String imagePath,
                             ToolCallListener listener) {
        context.turnLock().lock();
        try {
            return runTurn(context, userInput, imagePath, listener != null ? listener : ToolCallListener.NONE);
        } finally {
            context.turnLock().unlock();
        }
    }

    /**
     * Streams a tool-free reply, handing each text delta to {@code sink} as it
     * arrives. The full reply is recorded in the conversation like a normal turn.
     */
    public ChatResponse streamChat(ConversationContext context, String userInput, Consumer<String> sink) {
        context.turnLock().lock();
        try {
            RunContext runCtx = new RunContext();
            TurnState state = startTurn(context, userInput, null);
            if (state == null) {
                return discarded(context, List.of(), 0, runCtx);
            }

            LlmClient client = llmClientFactory.getClient(context.getProvider());
            String memoryBlock = recallMemory(state.getUserText());

            StringBuilder reply = new StringBuilder();
            long start = System.currentTimeMillis();
            try (Stream<String> deltas = client.chatStream(buildRequest(context, memoryBlock))) {
                deltas.forEach(delta -> {
                    reply.append(delta);
                    sink.accept(delta);
                });
            }
            runCtx.providerCallFinished(System.currentTimeMillis() - start, 0, 0);

            return finish(context, state, reply.toString(), false, runCtx);
        } finally {
            context.turnLock().unlock();
        }
    }

    /** Stores a memory outside of any turn, e.g. from the API. */
    public MemoryItem addMemory(MemoryType type, String content, double importance) {
        return memoryManager.addMemory(type, content, importance, Map.of("source", "manual"));
    }

    private ChatResponse runTurn(ConversationContext context,
                                 String userInput,
                                 String imagePath,
                                 ToolCallListener listener) {
        RunContext runCtx = new RunContext();
        TurnState state = startTurn(context, userInput, imagePath);
        if (state == null) {
            return discarded(context, List.of(), 0, runCtx);
        }

        LlmClient client = llmClientFactory.getClient(context.getProvider());
        String memoryBlock = recallMemory(state.getUserText());
        List<ToolDefinition> tools = toolDefinitions();
        int maxRounds = properties.getMaxToolIterations();

        LlmResponse response = callProvider(client, context, memoryBlock, tools, runCtx);

        while (response.hasToolCalls() && state.getToolRounds() < maxRounds) {
            log.info("Tool round {}/{} [session={}, calls={}]", state.getToolRounds() + 1, maxRounds,
                    state.getSessionId(), response.getToolCalls().size());

            Message request = Message.assistantToolCalls(response.getContent(), response.getToolCalls());
            if (!context.appendIfCurrent(state.getEpoch(), request)) {
                return discarded(context, state.getExecutedToolCalls(), state.getToolRounds(), runCtx);
            }

            for (ToolCall toolCall : response.getToolCalls()) {
                String result = executeTool(toolCall, listener, runCtx);
                state.getExecutedToolCalls().add(toolCall);
                Message toolMessage = Message.tool(toolCall.getId(), toolCall.getToolName(), result);
                if (!context.appendIfCurrent(state.getEpoch(), toolMessage)) {
                    return discarded(context, state.getExecutedToolCalls(), state.getToolRounds(), runCtx);
                }
            }
            state.setToolRounds(state.getToolRounds() + 1);

            response = callProvider(client, context, memoryBlock, tools, runCtx);
        }

        boolean ceilingReached = response.hasToolCalls();
        if (ceilingReached) {
            log.warn("Tool round limit ({}) reached, finalizing with current content [session={}]",
                    maxRounds, state.getSessionId());
        }
        return finish(context, state, response.getContent(), ceilingReached, runCtx);
    }

    /** Appends the user message. Returns null if the context was reset meanwhile. */
    private TurnState startTurn(ConversationContext context, String userInput, String imagePath) {
        long epoch = context.epoch();
        MultimodalContentBuilder.ParsedInput parsed = contentBuilder.parse(userInput);
        String image = (imagePath != null && !imagePath.isBlank()) ? imagePath : parsed.imagePath();
        MessageContent content = contentBuilder.build(parsed.text(), image, properties.isMultimodalEnabled());

        log.info("Turn started [session={}, image={}, input='{}']",
                context.getSessionId(), image != null, abbreviate(parsed.text()));

        if (!context.appendIfCurrent(epoch, Message.user(content))) {
            return null;
        }
        return TurnState.builder()
                .sessionId(context.getSessionId())
                .userText(parsed.text())
                .epoch(epoch)
                .build();
    }

    private ChatResponse finish(ConversationContext context,
                                TurnState state,
                                String content,
                                boolean ceilingReached,
                                RunContext runCtx) {
        String reply = (content == null || content.isBlank()) ? properties.getFallbackReply() : content;

        if (!context.appendIfCurrent(state.getEpoch(), Message.assistant(reply))) {
            return discarded(context, state.getExecutedToolCalls(), state.getToolRounds(), runCtx);
        }
        context.getMetadata().merge("turnCount", 1, (a, b) -> (Integer) a + (Integer) b);

        if (properties.getMemory().isEnabled()) {
            memoryExtractionService.extractAndStore(state.getUserText(), reply);
        }

        long latencyMs = runCtx.elapsedMs();
        log.info("Turn complete [session={}, toolRounds={}, providerCalls={}, providerMs={}, latency={}ms, tokens={}]",
                state.getSessionId(), state.getToolRounds(), runCtx.getProviderCalls(),
                runCtx.getProviderTimeMs(), latencyMs, runCtx.totalTokens());
        log.debug("Tool timings [session={}, total={}ms]: {}",
                state.getSessionId(), runCtx.toolTimeMs(), runCtx.toolSummary());

        return ChatResponse.builder()
                .reply(reply)
                .sessionId(state.getSessionId())
                .toolCallsExecuted(state.getExecutedToolCalls())
                .toolRounds(state.getToolRounds())
                .maxIterationsReached(ceilingReached)
                .promptTokens(runCtx.getPromptTokens())
                .completionTokens(runCtx.getCompletionTokens())
                .latencyMs(latencyMs)
                .build();
    }

    private LlmResponse callProvider(LlmClient client,
                                     ConversationContext context,
                                     String memoryBlock,
                                     List<ToolDefinition> tools,
                                     RunContext runCtx) {
        long start = System.currentTimeMillis();
        LlmResponse response = client.chat(buildRequest(context, memoryBlock), tools);
        runCtx.providerCallFinished(System.currentTimeMillis() - start,
                response.getPromptTokens(), response.getCompletionTokens());
        return response;
    }

    List<Message> buildRequest(ConversationContext context, String memoryBlock) {
        String system = context.getSystemPrompt();
        if (memoryBlock != null && !memoryBlock.isEmpty()) {
            system = system + "\n\n" + memoryBlock;
        }
        List<Message> request = new ArrayList<>();
        request.add(Message.system(system));
        request.addAll(context.recentNonSystem(properties.getHistoryLimit()));
        return request;
    }

    private String recallMemory(String userText) {
        if (!properties.getMemory().isEnabled()) {
            return "";
        }
        try {
            return memoryManager.formatForContext(userText, properties.getMemory().getRecallLimit());
        } catch (RuntimeException e) {
            log.warn("Memory recall failed, continuing without it: {}", e.getMessage());
            return "";
        }
    }

    private List<ToolDefinition> toolDefinitions() {
        if (!properties.isToolsEnabled() || toolRegistry.isEmpty()) {
            return List.of();
        }
        return toolRegistry.getAllDefinitions();
    }

    private String executeTool(ToolCall toolCall, ToolCallListener listener, RunContext runCtx) {
        try {
            listener.onToolCall(toolCall.getToolName(), toolCall.getArguments());
        } catch (RuntimeException e) {
            log.warn("Tool call listener failed: {}", e.getMessage());
        }

        long start = System.currentTimeMillis();
        String result = toolRegistry.execute(toolCall);
        runCtx.toolCallFinished(toolCall.getToolName(), System.currentTimeMillis() - start,
                result.startsWith(ToolRegistry.ERROR_PREFIX));

        try {
            listener.onToolResult(toolCall.getToolName(), result);
        } catch (RuntimeException e) {
            log.warn("Tool result listener failed: {}", e.getMessage());
        }
        return result;
    }

    private ChatResponse discarded(ConversationContext context, List<ToolCall> executed, int rounds, RunContext runCtx) {
        log.warn("Session [{}] was reset during the turn, result discarded", context.getSessionId());
        return ChatResponse.builder()
                .reply("")
                .sessionId(context.getSessionId())
                .toolCallsExecuted(executed)
                .toolRounds(rounds)
                .promptTokens(runCtx.getPromptTokens())
                .completionTokens(runCtx.getCompletionTokens())
                .latencyMs(runCtx.elapsedMs())
                .discarded(true)
                .build();
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
