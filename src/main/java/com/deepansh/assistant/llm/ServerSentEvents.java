package com.deepansh.assistant.llm;

import org.springframework.http.client.ClientHttpResponse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

/**
 * Minimal reader for text/event-stream bodies.
 */
final class ServerSentEvents {

    static final String DONE = "[DONE]";

    private ServerSentEvents() {
    }

    /**
     * Lazily yields the payload of every {@code data:} line until the
     * {@code [DONE]} sentinel or end of body. Closing the stream closes the response.
     */
    static Stream<String> dataPayloads(ClientHttpResponse response) throws IOException {
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8));
        return reader.lines()
                .filter(line -> line.startsWith("data:"))
                .map(line -> line.substring(5).trim())
                .filter(data -> !data.isEmpty())
                .takeWhile(data -> !DONE.equals(data))
                .onClose(response::close);
    }
}
