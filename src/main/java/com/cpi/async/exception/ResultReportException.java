package com.cpi.async.exception;

/**
 * Failure to deliver a calculation result. Never retried.
 */
public class ResultReportException extends CallbackApiException {

    public ResultReportException(String message, String requestId, Throwable cause) {
        super(message, requestId, cause);
    }

    public ResultReportException(String message, String requestId, int statusCode) {
        super(message, requestId, statusCode);
    }
}
