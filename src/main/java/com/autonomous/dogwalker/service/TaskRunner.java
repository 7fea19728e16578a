package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.NoChangesProducedException;
import com.autonomous.dogwalker.model.AgentRequest;
import com.autonomous.dogwalker.model.AgentResponse;
import com.autonomous.dogwalker.model.CancellationInfo;
import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.model.FeedbackMessage;
import com.autonomous.dogwalker.model.PullRequestRef;
import com.autonomous.dogwalker.model.TaskEffect;
import com.autonomous.dogwalker.model.TaskEvent;
import com.autonomous.dogwalker.model.TaskMessage;
import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.TaskProgress;
import com.autonomous.dogwalker.model.TaskReport;
import com.autonomous.dogwalker.model.TaskSummary;
import com.autonomous.dogwalker.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drives one task from QUEUED to a terminal phase. The transition table lives
 * in {@link TaskStateMachine}; this class carries out the effects it asks for
 * and turns their outcome into the next event.
 */
@Service
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final TaskStateMachine machine;
    private final CodingAgent agent;
    private final PullRequestPublisher publisher;
    private final GitService git;
    private final FeedbackRelayService relay;
    private final CancellationService cancellation;
    private final DogRegistryService registry;
    private final DogRosterService roster;
    private final ThreadManagerService thread;
    private final PullRequestBodyFormatter bodies;
    private final TransientRetry retry;
    private final Clock clock;

    @Value("${dogwalker.feedback.answer-timeout-seconds:600}")
    private long answerTimeoutSeconds = 600;

    public TaskRunner(TaskStateMachine machine, CodingAgent agent, PullRequestPublisher publisher,
                      GitService git, FeedbackRelayService relay, CancellationService cancellation,
                      DogRegistryService registry, DogRosterService roster, ThreadManagerService thread,
                      PullRequestBodyFormatter bodies, TransientRetry retry, Clock clock) {
        this.machine = machine;
        this.agent = agent;
        this.publisher = publisher;
        this.git = git;
        this.relay = relay;
        this.cancellation = cancellation;
        this.registry = registry;
        this.roster = roster;
        this.thread = thread;
        this.bodies = bodies;
        this.retry = retry;
        this.clock = clock;
    }

    public void setAnswerTimeoutSeconds(long answerTimeoutSeconds) {
        this.answerTimeoutSeconds = answerTimeoutSeconds;
    }

    /** State of a single run. */
    private static class Run {
        final TaskMessage task;
        final Dog dog;
        final Instant startedAt;
        final TaskSummary summary = new TaskSummary();
        final List<FeedbackMessage> pendingFeedback = new ArrayList<>();
        List<FeedbackMessage> lastRead = List.of();
        TaskPhase phase = TaskPhase.QUEUED;
        Path checkout;
        CancellationInfo cancelledBy;
        String failureCause;
        boolean released;

        Run(TaskMessage task, Dog dog, Instant startedAt) {
            this.task = task;
            this.dog = dog;
            this.startedAt = startedAt;
        }
    }

    public TaskReport run(TaskMessage task) {
        MDC.put("taskId", task.getTaskId());
        Run run = new Run(task, resolveDog(task), clock.instant());
        log.info("{} starting task: {}", run.dog.getName(), task.getTaskDescription());

        try {
            Transition transition = machine.transition(TaskPhase.QUEUED, TaskEvent.START);
            while (true) {
                run.phase = transition.getTarget();
                TaskEvent next = null;
                for (TaskEffect effect : transition.getEffects()) {
                    TaskEvent produced;
                    try {
                        produced = perform(effect, run);
                    } catch (RuntimeException e) {
                        produced = effectFailed(effect, run, e);
                    }
                    if (produced != null) {
                        next = produced;
                    }
                    if (next == TaskEvent.PHASE_FAILED) {
                        break;
                    }
                }
                if (run.phase.isTerminal()) {
                    break;
                }
                transition = machine.transition(run.phase, next);
            }
            try {
                recordProgress(run);
            } catch (RuntimeException e) {
                log.warn("Could not record final progress: {}", ErrorClassifier.describe(e));
            }
            log.info("Task finished in {}", run.phase);
            return report(run);
        } finally {
            if (!run.released) {
                releaseDog(run);
            }
            if (run.checkout != null) {
                git.cleanup(run.checkout);
            }
            MDC.remove("taskId");
        }
    }

    private TaskEvent perform(TaskEffect effect, Run run) {
        return switch (effect) {
            case CHECKPOINT -> checkpoint(run);
            case ACKNOWLEDGE_FEEDBACK -> {
                thread.postFeedbackAcknowledged(run.task, run.lastRead);
                yield null;
            }
            case RUN_PHASE -> runPhase(run);
            case PUBLISH_CANCELLATION -> {
                publishCancellation(run);
                yield null;
            }
            case REPORT_FAILURE -> {
                thread.postFailure(run.task, run.failureCause);
                yield null;
            }
            case ANNOUNCE_READY -> {
                thread.postCompletion(run.task, run.summary.getPullRequest());
                yield null;
            }
            case RELEASE_DOG -> {
                releaseDog(run);
                yield null;
            }
        };
    }

    /**
     * A failing effect before a terminal phase fails the task. Once terminal,
     * the failure is only logged so the remaining effects still run.
     */
    private TaskEvent effectFailed(TaskEffect effect, Run run, RuntimeException e) {
        String cause = ErrorClassifier.describe(e);
        log.error("{} in {} failed: {}", effect, run.phase, cause, e);
        if (run.phase.isTerminal()) {
            return null;
        }
        run.failureCause = cause;
        return TaskEvent.PHASE_FAILED;
    }

    private void releaseDog(Run run) {
        run.released = true;
        registry.markFree(run.task.getAgentName(), run.task.getTaskId());
    }

    /**
     * Cancellation first, then unread feedback. Feedback stays pending until
     * the next coding-agent call consumes it.
     */
    private TaskEvent checkpoint(Run run) {
        Optional<CancellationInfo> cancelled = cancellation.isCancelled(run.task.getTaskId());
        if (cancelled.isPresent()) {
            run.cancelledBy = cancelled.get();
            log.info("Cancellation by {} observed before {}", run.cancelledBy.getCancelledBy(), run.phase);
            return TaskEvent.CANCEL_OBSERVED;
        }

        List<FeedbackMessage> feedback = relay.peekNew(run.task.getTaskId());
        if (feedback.isEmpty()) {
            return TaskEvent.CHECKPOINT_CLEAR;
        }
        run.pendingFeedback.addAll(feedback);
        run.lastRead = List.copyOf(feedback);
        return TaskEvent.FEEDBACK_RECEIVED;
    }

    private TaskEvent runPhase(Run run) {
        log.info("Entering {}", run.phase);
        try {
            recordProgress(run);
            switch (run.phase) {
                case PLANNING -> plan(run);
                case DRAFT_OPENED -> openDraft(run);
                case IMPLEMENTING -> implement(run);
                case SELF_REVIEW -> review(run);
                case TESTING -> test(run);
                case FINALIZING -> finish(run);
                default -> throw new IllegalStateException("No phase body for " + run.phase);
            }
            run.summary.markCompleted(run.phase);
            return TaskEvent.PHASE_COMPLETED;
        } catch (RuntimeException e) {
            run.failureCause = ErrorClassifier.describe(e);
            log.error("{} failed: {}", run.phase, run.failureCause, e);
            return TaskEvent.PHASE_FAILED;
        }
    }

    // ------------------------------------------------------------------
    // Phase bodies
    // ------------------------------------------------------------------

    private void plan(Run run) {
        TaskMessage task = run.task;
        run.checkout = retry.call("clone repository",
            () -> git.prepareCheckout(task.getTaskId(), task.getBranchName(), run.dog));

        AgentResponse response = invokeAgent(run);
        run.summary.setPlan(ResponseParser.stripMarkers(response.getOutput()));
        run.summary.setTitle(response.getTitle() != null
            ? response.getTitle()
            : ResponseParser.shorten(task.getTaskDescription()));
        log.info("Plan ready, PR title: {}", run.summary.getTitle());
    }

    private void openDraft(Run run) {
        TaskMessage task = run.task;
        String title = run.summary.getTitle();
        retry.run("push " + task.getBranchName(),
            () -> git.pushEmptyBranch(run.checkout, task.getBranchName(), "Start: " + title));

        String body = bodies.draftBody(task, run.summary.getPlan());
        PullRequestRef pr = retry.call("create draft PR",
            () -> publisher.createDraft(task.getBranchName(), title, body));
        run.summary.setPullRequest(pr);
        thread.postDraftCreated(task, pr, run.summary.getPlan());
    }

    private void implement(Run run) {
        invokeAgent(run);
        List<String> files = git.getModifiedFiles(run.checkout);
        if (files.isEmpty()) {
            throw new NoChangesProducedException();
        }
        run.summary.setFilesTouched(files);
        log.info("Implementation touched {} file(s)", files.size());
    }

    private void review(Run run) {
        thread.postPhase(run.task, TaskPhase.SELF_REVIEW);
        AgentResponse response = invokeAgent(run);
        run.summary.setReviewNotes(ResponseParser.stripMarkers(response.getOutput()));
        run.summary.setFilesTouched(git.getModifiedFiles(run.checkout));
    }

    private void test(Run run) {
        thread.postPhase(run.task, TaskPhase.TESTING);
        AgentResponse response = invokeAgent(run);
        run.summary.setTestsPassed(response.getTestsPassed());
        run.summary.setTestOutput(ResponseParser.stripMarkers(response.getOutput()));
        if (Boolean.FALSE.equals(response.getTestsPassed())) {
            log.warn("Tests reported as failing; continuing so the PR shows the result");
        }
    }

    private void finish(Run run) {
        TaskMessage task = run.task;
        run.summary.setFilesTouched(git.getModifiedFiles(run.checkout));
        git.commitAll(run.checkout, run.summary.getTitle());
        retry.run("push " + task.getBranchName(), () -> git.push(run.checkout, task.getBranchName()));

        run.summary.setFeedbackTranscript(relay.renderForPr(task.getTaskId()));
        PullRequestRef pr = run.summary.getPullRequest();
        String body = bodies.finalBody(task, run.summary, elapsed(run));
        retry.run("update PR body", () -> publisher.updateBody(pr, body));
        retry.run("mark PR ready", () -> publisher.markReady(pr));
    }

    /**
     * One coding-agent call with any pending feedback folded in. If the agent
     * asks a question, waits for a reply in the thread and asks once more.
     */
    private AgentResponse invokeAgent(Run run) {
        String feedback = run.pendingFeedback.isEmpty() ? null : relay.formatForAgent(run.pendingFeedback);
        run.pendingFeedback.clear();
        String prompt = PromptBuilder.forPhase(run.phase, run.task.getTaskDescription(), run.summary, feedback);

        AgentResponse response = agent.invoke(request(run, prompt));
        if (!response.hasQuestion()) {
            return response;
        }

        String question = response.getQuestion();
        thread.postQuestion(run.task, question);
        Optional<FeedbackMessage> answer = relay.awaitNext(run.task.getTaskId(), Duration.ofSeconds(answerTimeoutSeconds));
        String followUp = answer
            .map(reply -> PromptBuilder.withAnswer(prompt, question, reply.getText()))
            .orElseGet(() -> PromptBuilder.withoutAnswer(prompt, question));
        log.info("Question {} in {}", answer.isPresent() ? "answered" : "timed out", run.phase);
        return agent.invoke(request(run, followUp));
    }

    private AgentRequest request(Run run, String prompt) {
        return AgentRequest.builder()
            .taskId(run.task.getTaskId())
            .phase(run.phase)
            .prompt(prompt)
            .workingDirectory(run.checkout)
            .dog(run.dog)
            .build();
    }

    // ------------------------------------------------------------------
    // Terminal effects
    // ------------------------------------------------------------------

    /**
     * Leaves the PR (if any) describing exactly which phases ran. Partial work
     * is pushed first so the draft matches its description.
     */
    private void publishCancellation(Run run) {
        TaskMessage task = run.task;
        String cancelledBy = run.cancelledBy.getCancelledBy();
        PullRequestRef pr = run.summary.getPullRequest();

        if (pr != null) {
            try {
                if (git.commitAll(run.checkout, "WIP: " + run.summary.getTitle() + " (cancelled)")) {
                    retry.run("push " + task.getBranchName(), () -> git.push(run.checkout, task.getBranchName()));
                }
                String body = bodies.cancelledBody(task, run.summary, cancelledBy, elapsed(run));
                retry.run("update PR body", () -> publisher.updateBody(pr, body));
            } catch (RuntimeException e) {
                log.error("Could not record cancellation on {}: {}", pr.getUrl(), ErrorClassifier.describe(e), e);
            }
        }

        try {
            thread.postCancelled(task, cancelledBy, run.summary.getCompletedPhases(), pr);
        } finally {
            cancellation.clearCancellation(task.getTaskId());
        }
    }

    private void recordProgress(Run run) {
        PullRequestRef pr = run.summary.getPullRequest();
        cancellation.recordProgress(run.task.getTaskId(), TaskProgress.builder()
            .phase(run.phase)
            .completedPhases(new ArrayList<>(run.summary.getCompletedPhases()))
            .prUrl(pr == null ? null : pr.getUrl())
            .updatedAt(clock.instant())
            .build());
    }

    private TaskReport report(Run run) {
        PullRequestRef pr = run.summary.getPullRequest();
        return TaskReport.builder()
            .taskId(run.task.getTaskId())
            .finalPhase(run.phase)
            .completedPhases(List.copyOf(run.summary.getCompletedPhases()))
            .pendingPhases(run.summary.getPendingPhases())
            .cancelledBy(run.cancelledBy == null ? null : run.cancelledBy.getCancelledBy())
            .failureCause(run.failureCause)
            .prUrl(pr == null ? null : pr.getUrl())
            .elapsed(elapsed(run))
            .build();
    }

    private Duration elapsed(Run run) {
        Instant started = run.task.getStartTime() != null ? run.task.getStartTime() : run.startedAt;
        return Duration.between(started, clock.instant());
    }

    private Dog resolveDog(TaskMessage task) {
        return roster.findDog(task.getAgentName()).orElseGet(() -> Dog.builder()
            .name(task.getAgentName())
            .displayName(task.getAgentDisplayName())
            .email(task.getAgentEmail())
            .build());
    }
}
