package com.autonomous.dogwalker.model;

public enum TaskEffect {
    CHECKPOINT,
    ACKNOWLEDGE_FEEDBACK,
    RUN_PHASE,
    PUBLISH_CANCELLATION,
    REPORT_FAILURE,
    ANNOUNCE_READY,
    RELEASE_DOG
}
