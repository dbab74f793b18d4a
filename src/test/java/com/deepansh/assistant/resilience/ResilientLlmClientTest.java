package com.deepansh.assistant.resilience;

import com.deepansh.assistant.config.LlmProperties;
import com.deepansh.assistant.llm.LlmClient;
import com.deepansh.assistant.llm.LlmConfigurationException;
import com.deepansh.assistant.llm.LlmProvider;
import com.deepansh.assistant.llm.LlmTransportException;
import com.deepansh.assistant.model.LlmResponse;
import com.deepansh.assistant.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientLlmClientTest {

    private static final List<Message> MESSAGES = List.of(Message.user("hi"));

    @Mock LlmClient delegate;

    private LlmProperties.Retry retry;
    private LlmProperties.CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        when(delegate.provider()).thenReturn(LlmProvider.OPENAI);
        retry = new LlmProperties.Retry();
        retry.setMaxAttempts(3);
        retry.setWaitMs(1);
        breaker = new LlmProperties.CircuitBreaker();
    }

    @Test
    void chat_retryableFailure_retriedUntilSuccess() {
        LlmResponse ok = LlmResponse.builder().content("ok").build();
        when(delegate.chat(anyList(), any()))
                .thenThrow(transport(true))
                .thenThrow(transport(true))
                .thenReturn(ok);

        LlmResponse response = new ResilientLlmClient(delegate, retry, breaker).chat(MESSAGES, List.of());

        assertThat(response.getContent()).isEqualTo("ok");
        verify(delegate, times(3)).chat(anyList(), any());
    }

    @Test
    void chat_retriesExhausted_lastErrorPropagates() {
        when(delegate.chat(anyList(), any())).thenThrow(transport(true));

        ResilientLlmClient client = new ResilientLlmClient(delegate, retry, breaker);

        assertThatThrownBy(() -> client.chat(MESSAGES, List.of())).isInstanceOf(LlmTransportException.class);
        verify(delegate, times(3)).chat(anyList(), any());
    }

    @Test
    void chat_configurationError_notRetried() {
        when(delegate.chat(anyList(), any())).thenThrow(new LlmConfigurationException("openai", "bad key"));

        ResilientLlmClient client = new ResilientLlmClient(delegate, retry, breaker);

        assertThatThrownBy(() -> client.chat(MESSAGES, List.of())).isInstanceOf(LlmConfigurationException.class);
        verify(delegate, times(1)).chat(anyList(), any());
    }

    @Test
    void chat_nonRetryableTransportError_notRetried() {
        when(delegate.chat(anyList(), any())).thenThrow(transport(false));

        ResilientLlmClient client = new ResilientLlmClient(delegate, retry, breaker);

        assertThatThrownBy(() -> client.chat(MESSAGES, List.of())).isInstanceOf(LlmTransportException.class);
        verify(delegate, times(1)).chat(anyList(), any());
    }

    @Test
    void chat_circuitOpen_failsFastWithoutCallingProvider() {
        retry.setMaxAttempts(1);
        breaker.setSlidingWindowSize(2);
        breaker.setFailureRateThreshold(50);
        when(delegate.chat(anyList(), any())).thenThrow(transport(true));
        ResilientLlmClient client = new ResilientLlmClient(delegate, retry, breaker);

        assertThatThrownBy(() -> client.chat(MESSAGES, List.of())).isInstanceOf(LlmTransportException.class);
        assertThatThrownBy(() -> client.chat(MESSAGES, List.of())).isInstanceOf(LlmTransportException.class);
        assertThat(client.circuitState()).isEqualTo(CircuitBreaker.State.OPEN);

        assertThatThrownBy(() -> client.chat(MESSAGES, List.of()))
                .isInstanceOfSatisfying(LlmTransportException.class, e -> assertThat(e.isRetryable()).isFalse())
                .hasMessageContaining("circuit open");
        verify(delegate, times(2)).chat(anyList(), any());
    }

    private static LlmTransportException transport(boolean retryable) {
        return new LlmTransportException("openai", "boom", retryable);
    }
}
