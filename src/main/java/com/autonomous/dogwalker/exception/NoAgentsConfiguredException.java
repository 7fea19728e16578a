package com.autonomous.dogwalker.exception;

public class NoAgentsConfiguredException extends DogwalkerException {

    public NoAgentsConfiguredException() {
        super("No dogs are configured to take tasks");
    }
}
