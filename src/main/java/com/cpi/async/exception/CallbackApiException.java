package com.cpi.async.exception;

/**
 * Exception thrown when a call to the collaborator service fails.
 * A status code of zero means the call never produced an HTTP response
 * (connection error, timeout, undecodable body).
 */
public class CallbackApiException extends RuntimeException {

    private final String requestId;
    private final int statusCode;

    public CallbackApiException(String message, String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
        this.statusCode = 0;
    }

    public CallbackApiException(String message, String requestId, int statusCode) {
        super(message);
        this.requestId = requestId;
        this.statusCode = statusCode;
    }

    public String getRequestId() {
        return requestId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isBadStatus() {
        return statusCode > 0;
    }

    public boolean isTransport() {
        return statusCode == 0;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "message='" + getMessage() + '\'' +
               ", requestId='" + requestId + '\'' +
               ", statusCode=" + statusCode +
               '}';
    }
}
