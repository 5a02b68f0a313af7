package com.cpi.async.service;

import com.cpi.async.domain.CalculationOutcome;
import com.cpi.async.domain.CalculationResultPayload;
import com.cpi.async.exception.ResultReportException;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Delivers a calculation outcome to the collaborator service with one PUT.
 * Delivery failures surface as {@link ResultReportException}; there is no retry.
 */
@Service
@Slf4j
public class ResultReporter {

    private final WebClient webClient;
    private final TimeLimiter timeLimiter;

    @Value("${cpi.callback.result-path:/{id}/async-result}")
    private String resultPath;

    public ResultReporter(WebClient callbackWebClient, TimeLimiter callbackTimeLimiter) {
        this.webClient = callbackWebClient;
        this.timeLimiter = callbackTimeLimiter;
    }

    /**
     * Sends the outcome.
     *
     * @param outcome outcome to deliver
     * @return Mono completing empty once the collaborator acknowledged the result
     */
    public Mono<Void> report(CalculationOutcome outcome) {
        String requestId = outcome.id();
        CalculationResultPayload payload = CalculationResultPayload.from(outcome);

        return webClient
                .put()
                .uri(resultPath, requestId)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> {
                                    log.warn("Failed to send results for request {}: HTTP {} body={}",
                                            requestId, response.statusCode().value(), body);
                                    return Mono.error(new ResultReportException(
                                            "Collaborator returned HTTP " + response.statusCode().value(),
                                            requestId,
                                            response.statusCode().value()
                                    ));
                                }))
                .toBodilessEntity()
                .doOnSuccess(response -> log.info("Sent personal CPI result for request {}: success={}",
                        requestId, payload.success()))
                .transformDeferred(TimeLimiterOperator.of(timeLimiter))
                .onErrorMap(ex -> !(ex instanceof ResultReportException), ex ->
                        new ResultReportException("Error sending results: " + ex.getMessage(), requestId, ex))
                .then();
    }
}
