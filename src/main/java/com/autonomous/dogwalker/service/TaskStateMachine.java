package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.TaskEvent;
import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.Transition;
import org.springframework.stereotype.Component;

import static com.autonomous.dogwalker.model.TaskEffect.ACKNOWLEDGE_FEEDBACK;
import static com.autonomous.dogwalker.model.TaskEffect.ANNOUNCE_READY;
import static com.autonomous.dogwalker.model.TaskEffect.CHECKPOINT;
import static com.autonomous.dogwalker.model.TaskEffect.PUBLISH_CANCELLATION;
import static com.autonomous.dogwalker.model.TaskEffect.RELEASE_DOG;
import static com.autonomous.dogwalker.model.TaskEffect.REPORT_FAILURE;
import static com.autonomous.dogwalker.model.TaskEffect.RUN_PHASE;

/**
 * Transition table for a task. Pure: given the current phase and what just
 * happened, returns the next phase and the effects the runner must carry out,
 * in order.
 *
 * <pre>
 *   QUEUED --START--> PLANNING
 *   X --PHASE_COMPLETED--> next(X)         [CHECKPOINT]  (checkpointed phases)
 *   X --CHECKPOINT_CLEAR--> X              [RUN_PHASE]
 *   X --FEEDBACK_RECEIVED--> X             [ACKNOWLEDGE_FEEDBACK, RUN_PHASE]
 *   X --CANCEL_OBSERVED--> CANCELLED       [PUBLISH_CANCELLATION, RELEASE_DOG]
 *   X --PHASE_FAILED--> FAILED             [REPORT_FAILURE, RELEASE_DOG]
 *   FINALIZING --PHASE_COMPLETED--> READY  [ANNOUNCE_READY, RELEASE_DOG]
 * </pre>
 */
@Component
public class TaskStateMachine {

    public Transition transition(TaskPhase from, TaskEvent event) {
        if (from.isTerminal()) {
            throw new IllegalStateException("Task already finished in " + from + "; cannot handle " + event);
        }

        return switch (event) {
            case START -> {
                requirePhase(from, TaskPhase.QUEUED, event);
                yield Transition.to(TaskPhase.PLANNING, RUN_PHASE);
            }
            case PHASE_COMPLETED -> completed(from);
            case CHECKPOINT_CLEAR -> {
                requireCheckpointed(from, event);
                yield Transition.to(from, RUN_PHASE);
            }
            case FEEDBACK_RECEIVED -> {
                requireCheckpointed(from, event);
                yield Transition.to(from, ACKNOWLEDGE_FEEDBACK, RUN_PHASE);
            }
            case CANCEL_OBSERVED -> Transition.to(TaskPhase.CANCELLED, PUBLISH_CANCELLATION, RELEASE_DOG);
            case PHASE_FAILED -> Transition.to(TaskPhase.FAILED, REPORT_FAILURE, RELEASE_DOG);
        };
    }

    private Transition completed(TaskPhase from) {
        if (from == TaskPhase.QUEUED) {
            throw new IllegalStateException("QUEUED has no phase body to complete");
        }
        TaskPhase next = from.next();
        if (next == TaskPhase.READY) {
            return Transition.to(TaskPhase.READY, ANNOUNCE_READY, RELEASE_DOG);
        }
        return next.isEnteredThroughCheckpoint()
            ? Transition.to(next, CHECKPOINT)
            : Transition.to(next, RUN_PHASE);
    }

    private static void requirePhase(TaskPhase actual, TaskPhase expected, TaskEvent event) {
        if (actual != expected) {
            throw new IllegalStateException(event + " is only valid in " + expected + ", not " + actual);
        }
    }

    private static void requireCheckpointed(TaskPhase phase, TaskEvent event) {
        if (!phase.isEnteredThroughCheckpoint()) {
            throw new IllegalStateException(event + " is not valid for " + phase + ", which has no checkpoint");
        }
    }
}
