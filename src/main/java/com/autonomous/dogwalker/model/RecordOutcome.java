package com.autonomous.dogwalker.model;

import lombok.Value;

@Value
public class RecordOutcome {
    public static final RecordOutcome UNBOUND = new RecordOutcome(null, 0);

    String taskId;
    long sequence;

    public boolean isRecorded() {
        return taskId != null;
    }
}
