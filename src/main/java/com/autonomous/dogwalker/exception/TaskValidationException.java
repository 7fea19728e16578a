package com.autonomous.dogwalker.exception;

/**
 * A failure that needs a human: retrying the same input gives the same result.
 */
public class TaskValidationException extends DogwalkerException {

    public TaskValidationException(String message) {
        super(message);
    }

    public TaskValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
