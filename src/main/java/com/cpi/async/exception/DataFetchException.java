package com.cpi.async.exception;

/**
 * Failure to fetch the input data of a request.
 */
public class DataFetchException extends CallbackApiException {

    public DataFetchException(String message, String requestId, Throwable cause) {
        super(message, requestId, cause);
    }

    public DataFetchException(String message, String requestId, int statusCode) {
        super(message, requestId, statusCode);
    }
}
