package com.deepansh.assistant.llm;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Maps provider error statuses onto the LLM exception taxonomy.
 *
 * | Status        | Exception                                  |
 * |---------------|--------------------------------------------|
 * | 401, 403      | LlmConfigurationException (not retried)    |
 * | 429           | LlmTransportException, retryable           |
 * | 5xx           | LlmTransportException, retryable           |
 * | other 4xx     | LlmTransportException, not retryable       |
 */
@Slf4j
final class ProviderErrors {

    private ProviderErrors() {
    }

    static LlmException fromResponse(LlmProvider provider, ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        log.error("{} returned [{}]: {}", provider.id(), status, body);
        return fromStatus(provider, status, body);
    }

    static LlmException fromStatus(LlmProvider provider, int status, String body) {
        if (status == 401 || status == 403) {
            return new LlmConfigurationException(provider.id(),
                    provider.id() + " rejected the API key [" + status + "]. Check " + provider.apiKeyEnvVar() + ".");
        }
        if (status == 429) {
            return new LlmTransportException(provider.id(), provider.id() + " rate limit exceeded", true);
        }
        if (status >= 500) {
            return new LlmTransportException(provider.id(),
                    provider.id() + " server error [" + status + "]: " + abbreviate(body), true);
        }
        return new LlmTransportException(provider.id(),
                provider.id() + " client error [" + status + "]: " + abbreviate(body), false);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
