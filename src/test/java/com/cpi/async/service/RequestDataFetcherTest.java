package com.cpi.async.service;

import com.cpi.async.config.WebClientConfig;
import com.cpi.async.exception.DataFetchException;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestDataFetcher WireMock Tests")
class RequestDataFetcherTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private RequestDataFetcher fetcher;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://localhost:" + wireMock.getPort() + "/api/calculate-cpi")
                .defaultHeader(WebClientConfig.AUTH_HEADER, "test-token")
                .build();

        TimeLimiter timeLimiter = TimeLimiter.of("cpiCallback", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(500))
                .build());

        fetcher = new RequestDataFetcher(webClient, timeLimiter);
        ReflectionTestUtils.setField(fetcher, "dataPath", "/{id}/async-data");
    }

    @Test
    @DisplayName("Should decode categories and comparison date")
    void shouldDecodeRequestData() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/42/async-data"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "categories": [
                                        {"id": 1, "userSpent": 150.0, "basePrice": 100.0, "name": "Food"},
                                        {"id": 2, "userSpent": null, "basePrice": 20}
                                    ],
                                    "comparisonDate": "2024-01-01"
                                }
                                """)));

        // When/Then
        StepVerifier.create(fetcher.fetch("42"))
                .assertNext(data -> {
                    assertThat(data.comparisonDate()).isEqualTo("2024-01-01");
                    assertThat(data.categories()).hasSize(2);
                    assertThat(data.categories().get(0).id()).isEqualTo("1");
                    assertThat(data.categories().get(0).userSpent()).isEqualByComparingTo("150");
                    assertThat(data.categories().get(1).userSpentOrZero()).isZero();
                })
                .verifyComplete();

        wireMock.verify(exactly(1), getRequestedFor(urlEqualTo("/api/calculate-cpi/42/async-data"))
                .withHeader("X-Auth-Token", equalTo("test-token")));
    }

    @Test
    @DisplayName("Should treat missing fields as empty")
    void shouldTreatMissingFieldsAsEmpty() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/7/async-data"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{}")));

        // When/Then
        StepVerifier.create(fetcher.fetch("7"))
                .assertNext(data -> {
                    assertThat(data.categories()).isEmpty();
                    assertThat(data.comparisonDate()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should map non-success status to a bad-status fetch error without retrying")
    void shouldMapBadStatus() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/42/async-data"))
                .willReturn(aResponse()
                        .withStatus(500)
                        .withBody("Internal Server Error")));

        // When/Then
        StepVerifier.create(fetcher.fetch("42"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DataFetchException.class);
                    DataFetchException ex = (DataFetchException) error;
                    assertThat(ex.isBadStatus()).isTrue();
                    assertThat(ex.getStatusCode()).isEqualTo(500);
                    assertThat(ex.getRequestId()).isEqualTo("42");
                })
                .verify();

        wireMock.verify(exactly(1), getRequestedFor(urlEqualTo("/api/calculate-cpi/42/async-data")));
    }

    @Test
    @DisplayName("Should map 404 to a bad-status fetch error")
    void shouldMapNotFound() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/99/async-data"))
                .willReturn(aResponse().withStatus(404)));

        // When/Then
        StepVerifier.create(fetcher.fetch("99"))
                .expectErrorSatisfies(error ->
                        assertThat(((DataFetchException) error).getStatusCode()).isEqualTo(404))
                .verify();
    }

    @Test
    @DisplayName("Should map a slow response to a transport fetch error")
    void shouldMapTimeout() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/42/async-data"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(3000)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{}")));

        // When/Then
        StepVerifier.create(fetcher.fetch("42"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DataFetchException.class);
                    assertThat(((DataFetchException) error).isTransport()).isTrue();
                })
                .verify(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("Should map connection refused to a transport fetch error")
    void shouldMapConnectionRefused() {
        // Given
        WebClient badWebClient = WebClient.builder()
                .baseUrl("http://localhost:9999") // Non-existent port
                .build();
        RequestDataFetcher badFetcher = new RequestDataFetcher(badWebClient, TimeLimiter.ofDefaults("test"));
        ReflectionTestUtils.setField(badFetcher, "dataPath", "/{id}/async-data");

        // When/Then
        StepVerifier.create(badFetcher.fetch("42"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(DataFetchException.class);
                    assertThat(((DataFetchException) error).isTransport()).isTrue();
                })
                .verify(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("Should map malformed JSON to a transport fetch error")
    void shouldMapMalformedJson() {
        // Given
        wireMock.stubFor(get(urlEqualTo("/api/calculate-cpi/42/async-data"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{ invalid json")));

        // When/Then
        StepVerifier.create(fetcher.fetch("42"))
                .expectError(DataFetchException.class)
                .verify();
    }
}
