package com.autonomous.dogwalker.exception;

import lombok.Getter;

@Getter
public class AlreadyBoundException extends DogwalkerException {

    private final String threadTs;
    private final String existingTaskId;

    public AlreadyBoundException(String threadTs, String existingTaskId) {
        super("Thread " + threadTs + " is already bound to task " + existingTaskId);
        this.threadTs = threadTs;
        this.existingTaskId = existingTaskId;
    }
}
