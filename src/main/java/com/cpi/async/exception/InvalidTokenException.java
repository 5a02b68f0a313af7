package com.cpi.async.exception;

/**
 * Thrown when an inbound trigger presents a token other than the shared secret.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException() {
        super("Invalid token");
    }
}
