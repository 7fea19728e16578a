package com.autonomous.dogwalker.model;

public enum TaskEvent {
    START,
    PHASE_COMPLETED,
    CHECKPOINT_CLEAR,
    FEEDBACK_RECEIVED,
    CANCEL_OBSERVED,
    PHASE_FAILED
}
