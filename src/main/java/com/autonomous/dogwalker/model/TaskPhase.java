package com.autonomous.dogwalker.model;

import java.util.List;

/**
 * Phases a task moves through, in order. {@code FAILED} and {@code CANCELLED}
 * can be reached from any non-terminal phase.
 */
public enum TaskPhase {
    QUEUED,
    PLANNING,
    DRAFT_OPENED,
    IMPLEMENTING,
    SELF_REVIEW,
    TESTING,
    FINALIZING,
    READY,
    FAILED,
    CANCELLED;

    /** Phases with a body of work, in execution order. */
    public static final List<TaskPhase> WORK_PHASES = List.of(
        PLANNING, DRAFT_OPENED, IMPLEMENTING, SELF_REVIEW, TESTING, FINALIZING
    );

    public boolean isTerminal() {
        return this == READY || this == FAILED || this == CANCELLED;
    }

    /** Every work phase after PLANNING is entered through a checkpoint. */
    public boolean isEnteredThroughCheckpoint() {
        return WORK_PHASES.contains(this) && this != PLANNING;
    }

    public TaskPhase next() {
        return switch (this) {
            case QUEUED -> PLANNING;
            case PLANNING -> DRAFT_OPENED;
            case DRAFT_OPENED -> IMPLEMENTING;
            case IMPLEMENTING -> SELF_REVIEW;
            case SELF_REVIEW -> TESTING;
            case TESTING -> FINALIZING;
            case FINALIZING -> READY;
            default -> throw new IllegalStateException("No phase follows " + this);
        };
    }

    public String label() {
        return switch (this) {
            case PLANNING -> "planning";
            case DRAFT_OPENED -> "draft PR";
            case IMPLEMENTING -> "implementation";
            case SELF_REVIEW -> "self-review";
            case TESTING -> "testing";
            case FINALIZING -> "finalizing";
            default -> name().toLowerCase();
        };
    }
}
