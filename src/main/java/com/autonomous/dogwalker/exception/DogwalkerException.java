package com.autonomous.dogwalker.exception;

/**
 * Root of the failures the orchestrator knows how to classify.
 */
public class DogwalkerException extends RuntimeException {

    public DogwalkerException(String message) {
        super(message);
    }

    public DogwalkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
