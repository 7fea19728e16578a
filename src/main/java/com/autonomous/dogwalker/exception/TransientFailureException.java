package com.autonomous.dogwalker.exception;

/**
 * Network timeout, rejected push or rate limit. Worth retrying.
 */
public class TransientFailureException extends DogwalkerException {

    public TransientFailureException(String message) {
        super(message);
    }

    public TransientFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
