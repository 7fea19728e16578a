package com.autonomous.dogwalker.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Terminal outcome of one task run.
 */
@Value
@Builder
public class TaskReport {
    String taskId;
    TaskPhase finalPhase;
    List<TaskPhase> completedPhases;
    List<TaskPhase> pendingPhases;
    String cancelledBy;
    String failureCause;
    String prUrl;
    Duration elapsed;
}
