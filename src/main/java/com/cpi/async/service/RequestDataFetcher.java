package com.cpi.async.service;

import com.cpi.async.config.ResilienceConfig;
import com.cpi.async.domain.RequestData;
import com.cpi.async.exception.DataFetchException;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Fetches the category data of an application from the collaborator service.
 * One GET per call, bounded by the {@value ResilienceConfig#CALLBACK_INSTANCE}
 * time limiter, never retried.
 */
@Service
@Slf4j
public class RequestDataFetcher {

    private final WebClient webClient;
    private final TimeLimiter timeLimiter;

    @Value("${cpi.callback.data-path:/{id}/async-data}")
    private String dataPath;

    public RequestDataFetcher(WebClient callbackWebClient, TimeLimiter callbackTimeLimiter) {
        this.webClient = callbackWebClient;
        this.timeLimiter = callbackTimeLimiter;
    }

    /**
     * Fetches the input data for a request.
     *
     * @param requestId application identifier
     * @return Mono with the decoded data; errors with {@link DataFetchException}
     */
    public Mono<RequestData> fetch(String requestId) {
        log.info("Fetching request data for request {}", requestId);

        return webClient
                .get()
                .uri(dataPath, requestId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> {
                                    log.warn("Failed to fetch request {}: HTTP {} body={}",
                                            requestId, response.statusCode().value(), body);
                                    return Mono.error(new DataFetchException(
                                            "Collaborator returned HTTP " + response.statusCode().value(),
                                            requestId,
                                            response.statusCode().value()
                                    ));
                                }))
                .bodyToMono(RequestData.class)
                .switchIfEmpty(Mono.error(() -> new DataFetchException(
                        "Collaborator returned an empty body", requestId, (Throwable) null)))
                .doOnSuccess(data -> log.info("Request {}: found {} categories, comparisonDate: {}",
                        requestId, data.categories().size(), data.comparisonDate()))
                .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                .onErrorMap(ex -> !(ex instanceof DataFetchException), ex ->
                        new DataFetchException("Error fetching request data: " + ex.getMessage(), requestId, ex));
    }
}
