package com.cpi.async.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient that talks to the collaborator service.
 * Both outbound calls (data fetch and result delivery) share this client,
 * its timeouts and its authentication header.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    public static final String AUTH_HEADER = "X-Auth-Token";

    @Value("${cpi.callback.base-url}")
    private String callbackBaseUrl;

    @Value("${cpi.callback.timeout.connection:5000}")
    private int connectionTimeout;

    @Value("${cpi.callback.timeout.request:10000}")
    private int requestTimeout;

    @Value("${cpi.auth.token}")
    private String authToken;

    /**
     * Creates the collaborator WebClient.
     * Features:
     * - Small connection pool (the worker makes one call at a time)
     * - Connection timeout (5s default)
     * - Response/read/write timeout (10s default)
     * - Shared-secret header on every request
     * - Request/response logging
     */
    @Bean
    public WebClient callbackWebClient() {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("cpi-callback-pool")
                .maxConnections(10)
                .maxIdleTime(Duration.ofSeconds(20))
                .maxLifeTime(Duration.ofMinutes(5))
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .evictInBackground(Duration.ofSeconds(120))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectionTimeout)
                .responseTimeout(Duration.ofMillis(requestTimeout))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(requestTimeout, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(requestTimeout, TimeUnit.MILLISECONDS))
                );

        return WebClient.builder()
                .baseUrl(callbackBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(AUTH_HEADER, authToken)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Logs outgoing requests. The auth header value is never written out.
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            if (log.isDebugEnabled()) {
                log.debug("Request: {} {}", clientRequest.method(), clientRequest.url());
                clientRequest.headers().forEach((name, values) -> {
                    if (!AUTH_HEADER.equalsIgnoreCase(name)) {
                        values.forEach(value -> log.debug("{}={}", name, value));
                    }
                });
            }
            return Mono.just(clientRequest);
        });
    }

    /**
     * Logs incoming responses.
     */
    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (log.isDebugEnabled()) {
                log.debug("Response Status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
