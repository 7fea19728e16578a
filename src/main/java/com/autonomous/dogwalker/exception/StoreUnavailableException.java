package com.autonomous.dogwalker.exception;

/**
 * The shared coordination store could not be reached.
 */
public class StoreUnavailableException extends DogwalkerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
