package com.deepansh.assistant.resilience;

import com.deepansh.assistant.config.LlmProperties;
import com.deepansh.assistant.llm.LlmClient;
import com.deepansh.assistant.llm.LlmProvider;
import com.deepansh.assistant.llm.LlmTransportException;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.tool.ToolDefinition;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Decorator that adds retry and a circuit breaker to a provider client.
 *
 * Retry: exponential backoff, only for retryable {@link LlmTransportException}s
 * (network errors, 429, 5xx). Configuration errors and malformed responses fail
 * on the first attempt.
 *
 * Circuit breaker: counts transport failures only; while open, calls fail fast
 * with a non-retryable transport error. The orchestration loop never retries on
 * its own, so a failure that survives this layer ends the turn.
 *
 * Streaming calls are passed straight through: a partially consumed stream
 * cannot be replayed.
 */
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;

    public ResilientLlmClient(LlmClient delegate,
                              LlmProperties.Retry retryProps,
                              LlmProperties.CircuitBreaker breakerProps) {
        this.delegate = delegate;
        String name = "llm-" + delegate.provider().id();

        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(Math.max(1, retryProps.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Math.max(1, retryProps.getWaitMs()), retryProps.getMultiplier()))
                .retryOnException(ResilientLlmClient::isRetryable)
                .build());

        this.circuitBreaker = CircuitBreaker.of(name, CircuitBreakerConfig.custom()
                .failureRateThreshold(breakerProps.getFailureRateThreshold())
                .slidingWindowSize(breakerProps.getSlidingWindowSize())
                .waitDurationInOpenState(Duration.ofSeconds(breakerProps.getWaitInOpenStateSeconds()))
                .recordException(e -> e instanceof LlmTransportException)
                .build());

        retry.getEventPublisher().onRetry(event -> log.warn("Retrying {} call (attempt {}): {}",
                delegate.provider().id(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Circuit breaker [{}] {}", name, event.getStateTransition()));
    }

    @Override
    public LlmProvider provider() {
        return delegate.provider();
    }

    @Override
    public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
        Supplier<LlmResponse> guarded = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> delegate.chat(messages, tools));
        try {
            return Retry.decorateSupplier(retry, guarded).get();
        } catch (CallNotPermittedException e) {
            log.error("{} circuit breaker is OPEN, rejecting call", delegate.provider().id());
            throw new LlmTransportException(delegate.provider().id(),
                    delegate.provider().id() + " is temporarily unavailable (circuit open)", false, e);
        }
    }

    @Override
    public Stream<String> chatStream(List<Message> messages) {
        return delegate.chatStream(messages);
    }

    CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    private static boolean isRetryable(Throwable e) {
        return e instanceof LlmTransportException transport && transport.isRetryable();
    }
}
