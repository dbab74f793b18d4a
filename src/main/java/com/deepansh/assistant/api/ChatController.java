package com.deepansh.assistant.api;

import com.deepansh.assistant.core.AgentLoop;
import com.deepansh.assistant.core.ConversationContext;
import com.deepansh.assistant.core.SessionService;
import com.deepansh.assistant.exception.SessionNotFoundException;
import com.deepansh.assistant.llm.LlmClientFactory;
import com.deepansh.assistant.llm.LlmProvider;
import com.deepansh.assistant.model.ChatRequest;
import com.deepansh.assistant.model.ChatResponse;
import com.deepansh.assistant.model.Message;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Conversation endpoints.
 *
 * POST   /api/v1/chat                      one turn, JSON response
 * POST   /api/v1/chat/stream               one tool-free turn, text/plain deltas
 * POST   /api/v1/chat/{sessionId}/reset    clear history, keep the system prompt
 * GET    /api/v1/chat/{sessionId}/history
 * DELETE /api/v1/chat/{sessionId}
 * GET    /api/v1/chat/providers
 * GET    /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final AgentLoop agentLoop;
    private final SessionService sessionService;
    private final LlmClientFactory llmClientFactory;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [sessionId={}, provider={}, image={}]",
                request.getSessionId(), request.getProvider(), request.getImagePath() != null);

        ConversationContext context = contextFor(request);
        return ResponseEntity.ok(agentLoop.chat(context, request.getInput(), request.getImagePath(), null));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<StreamingResponseBody> stream(@Valid @RequestBody ChatRequest request) {
        ConversationContext context = contextFor(request);
        // Resolve the client up front so configuration errors map to a status code
        llmClientFactory.getClient(context.getProvider());

        StreamingResponseBody body = out -> agentLoop.streamChat(context, request.getInput(), delta -> {
            try {
                out.write(delta.getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return ResponseEntity.ok()
                .header("X-Session-Id", context.getSessionId())
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(body);
    }

    @PostMapping("/{sessionId}/reset")
    public ResponseEntity<Map<String, String>> reset(@PathVariable String sessionId) {
        sessionService.reset(sessionId);
        return ResponseEntity.ok(Map.of("message", "Session reset", "sessionId", sessionId));
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<List<Message>> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.history(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String sessionId) {
        if (!sessionService.delete(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return ResponseEntity.ok(Map.of("message", "Session deleted", "sessionId", sessionId));
    }

    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> providers() {
        List<String> available = llmClientFactory.availableProviders().stream().map(LlmProvider::id).toList();
        String defaultProvider = available.isEmpty() ? null : llmClientFactory.defaultProvider().id();
        return ResponseEntity.ok(Map.of(
                "available", available,
                "default", defaultProvider != null ? defaultProvider : ""));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private ConversationContext contextFor(ChatRequest request) {
        ConversationContext context = sessionService.getOrCreate(request.getSessionId());
        if (request.getProvider() != null && !request.getProvider().isBlank()) {
            context.setProvider(LlmProvider.fromId(request.getProvider()).id());
        }
        return context;
    }
}
