package com.autonomous.dogwalker.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a task has produced so far. Filled in phase by phase and used
 * for the PR body and for partial reports.
 */
@Data
public class TaskSummary {
    private String title;
    private String plan;
    private List<String> filesTouched = new ArrayList<>();
    private String reviewNotes;
    private Boolean testsPassed;
    private String testOutput;
    private String feedbackTranscript;
    private PullRequestRef pullRequest;
    private final List<TaskPhase> completedPhases = new ArrayList<>();

    public void markCompleted(TaskPhase phase) {
        if (!completedPhases.contains(phase)) {
            completedPhases.add(phase);
        }
    }

    public List<TaskPhase> getPendingPhases() {
        List<TaskPhase> pending = new ArrayList<>(TaskPhase.WORK_PHASES);
        pending.removeAll(completedPhases);
        return pending;
    }
}
