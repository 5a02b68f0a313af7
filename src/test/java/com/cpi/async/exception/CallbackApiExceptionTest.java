package com.cpi.async.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CallbackApiException Unit Tests")
class CallbackApiExceptionTest {

    @Test
    @DisplayName("Should classify an HTTP status as a bad-status failure")
    void shouldClassifyBadStatus() {
        DataFetchException ex = new DataFetchException("error", "42", 500);
        assertThat(ex.getStatusCode()).isEqualTo(500);
        assertThat(ex.isBadStatus()).isTrue();
        assertThat(ex.isTransport()).isFalse();
    }

    @Test
    @DisplayName("Should classify a failure without status as a transport failure")
    void shouldClassifyTransport() {
        TimeoutException cause = new TimeoutException();
        ResultReportException ex = new ResultReportException("timed out", "42", cause);
        assertThat(ex.getStatusCode()).isZero();
        assertThat(ex.isTransport()).isTrue();
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    @DisplayName("Should include type, request id and status code in toString")
    void shouldIncludeFieldsInToString() {
        String str = new ResultReportException("service error", "42", 502).toString();
        assertThat(str).contains("ResultReportException");
        assertThat(str).contains("service error");
        assertThat(str).contains("42");
        assertThat(str).contains("502");
    }
}
