package com.deepansh.assistant.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Apache HttpClient 5 behind Spring's RestClient.
 *
 * Each provider client gets its own pooled HttpClient so the response timeout
 * configured for that provider applies to every call it makes.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /** Shared builder for tool HTTP calls (web search, image generation). */
    @Bean
    @Primary
    public RestClient.Builder restClientBuilder() {
        return builderWithTimeout(Duration.ofSeconds(60));
    }

    /**
     * Returns a fresh builder whose requests fail once the server has been
     * silent for longer than {@code responseTimeout}.
     */
    public static RestClient.Builder builderWithTimeout(Duration responseTimeout) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.of(CONNECT_TIMEOUT))
                                .setSocketTimeout(Timeout.of(responseTimeout))
                                .build())
                        .setMaxConnTotal(50)
                        .setMaxConnPerRoute(20)
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.of(responseTimeout))
                        .build())
                .build();

        log.debug("HttpClient configured [responseTimeout={}s]", responseTimeout.toSeconds());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
