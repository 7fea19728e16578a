package com.autonomous.dogwalker.exception;

public class NoChangesProducedException extends TaskValidationException {

    public NoChangesProducedException() {
        super("The coding agent did not produce any code changes. Try rephrasing the request with more detail.");
    }
}
