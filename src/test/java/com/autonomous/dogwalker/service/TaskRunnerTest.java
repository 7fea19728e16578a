package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.StoreUnavailableException;
import com.autonomous.dogwalker.exception.TransientFailureException;
import com.autonomous.dogwalker.model.AgentRequest;
import com.autonomous.dogwalker.model.AgentResponse;
import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.model.FeedbackMessage;
import com.autonomous.dogwalker.model.PullRequestRef;
import com.autonomous.dogwalker.model.TaskMessage;
import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.TaskReport;
import com.autonomous.dogwalker.store.InMemoryCoordinationStore;
import com.autonomous.dogwalker.store.MutableClock;
import com.autonomous.dogwalker.store.StoreKeys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.autonomous.dogwalker.model.TaskPhase.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskRunnerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String THREAD = "1714550400.000100";
    private static final String TASK_ID = "C123_" + THREAD;
    private static final Path CHECKOUT = Path.of("workdir", "C123_1714550400.000100");
    private static final PullRequestRef PR = new PullRequestRef("https://github.com/acme/app/pull/7", "Add rate limiting");

    @Mock
    private CodingAgent agent;

    @Mock
    private PullRequestPublisher publisher;

    @Mock
    private GitService git;

    @Mock
    private ThreadManagerService thread;

    private final Dog coregi = Dog.builder().name("Coregi").displayName("Coregi").email("coregi@example.dev").build();
    private final List<Duration> slept = new ArrayList<>();

    private MutableClock clock;
    private SwitchableStore store;
    private FeedbackRelayService relay;
    private CancellationService cancellation;
    private DogRegistryService registry;
    private TaskRunner runner;
    private TaskMessage task;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new SwitchableStore(clock);
        StoreKeys keys = new StoreKeys("test");

        DogRosterService roster = new DogRosterService();
        roster.replaceDogs(List.of(coregi));
        registry = new DogRegistryService(roster, store, keys);
        relay = new FeedbackRelayService(store, keys);
        relay.setPollIntervalMs(10);
        cancellation = new CancellationService(store, keys, clock);

        TransientRetry retry = TransientRetry.withBackoffs(
            List.of(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)), slept::add);

        runner = new TaskRunner(new TaskStateMachine(), agent, publisher, git, relay, cancellation,
            registry, roster, thread, new PullRequestBodyFormatter(), retry, clock);
        runner.setAnswerTimeoutSeconds(2);

        task = TaskMessage.builder()
            .taskId(TASK_ID)
            .taskDescription("add rate limiting to /api/login")
            .branchName("coregi/add-rate-limiting-to-api-login")
            .agentName("Coregi")
            .agentDisplayName("Coregi")
            .agentEmail("coregi@example.dev")
            .threadTs(THREAD)
            .channelId("C123")
            .requesterName("Alice")
            .startTime(NOW)
            .build();

        registry.markBusy(coregi, TASK_ID);
        relay.bind(THREAD, TASK_ID);

        lenient().when(git.prepareCheckout(TASK_ID, task.getBranchName(), coregi)).thenReturn(CHECKOUT);
        lenient().when(git.getModifiedFiles(CHECKOUT)).thenReturn(List.of("src/main/java/LoginController.java"));
        lenient().when(git.commitAll(eq(CHECKOUT), anyString())).thenReturn(true);
        lenient().when(publisher.createDraft(anyString(), anyString(), anyString())).thenReturn(PR);
    }

    @AfterEach
    void tearDown() {
        relay.shutdown();
    }

    @Test
    void shouldRunAllPhasesAndOpenReadyPullRequest() {
        agentAnswers(request -> defaultAnswer(request.getPhase()));

        TaskReport report = runner.run(task);

        assertEquals(READY, report.getFinalPhase());
        assertEquals(TaskPhase.WORK_PHASES, report.getCompletedPhases());
        assertTrue(report.getPendingPhases().isEmpty());
        assertEquals(PR.getUrl(), report.getPrUrl());

        verify(publisher).createDraft(eq(task.getBranchName()), eq("Add rate limiting"), contains("LoginController"));
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(publisher).updateBody(eq(PR), body.capture());
        assertTrue(body.getValue().contains("All tests passed"));
        assertTrue(body.getValue().contains("`src/main/java/LoginController.java`"));
        verify(publisher).markReady(PR);
        verify(git).push(CHECKOUT, task.getBranchName());
        verify(thread).postCompletion(task, PR);
        verify(git).cleanup(CHECKOUT);
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldStopAtNextCheckpointWhenCancelledDuringSelfReview() {
        agentAnswers(request -> {
            if (request.getPhase() == SELF_REVIEW) {
                cancellation.requestCancel(TASK_ID, "Alice", "U1");
            }
            return defaultAnswer(request.getPhase());
        });

        TaskReport report = runner.run(task);

        assertEquals(CANCELLED, report.getFinalPhase());
        assertEquals(List.of(PLANNING, DRAFT_OPENED, IMPLEMENTING, SELF_REVIEW), report.getCompletedPhases());
        assertEquals(List.of(TESTING, FINALIZING), report.getPendingPhases());
        assertEquals("Alice", report.getCancelledBy());

        verify(agent, never()).invoke(argThat(request -> request.getPhase() == TESTING));
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(publisher).updateBody(eq(PR), body.capture());
        assertTrue(body.getValue().contains("Cancelled by **Alice**"));
        assertTrue(body.getValue().contains("Not completed: testing, finalizing"));
        verify(publisher, never()).markReady(any());
        verify(thread).postCancelled(eq(task), eq("Alice"), anyList(), eq(PR));

        assertTrue(cancellation.isCancelled(TASK_ID).isEmpty());
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldFailWithoutRetryWhenNoChangesProduced() {
        agentAnswers(request -> defaultAnswer(request.getPhase()));
        when(git.getModifiedFiles(CHECKOUT)).thenReturn(List.of());

        TaskReport report = runner.run(task);

        assertEquals(FAILED, report.getFinalPhase());
        assertEquals(List.of(PLANNING, DRAFT_OPENED), report.getCompletedPhases());
        assertTrue(report.getFailureCause().contains("did not produce any code changes"));
        verify(agent, times(2)).invoke(any());
        verify(thread).postFailure(eq(task), contains("did not produce any code changes"));
        assertTrue(slept.isEmpty());
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldRetryTransientPushFailureThreeTimesThenFail() {
        agentAnswers(request -> defaultAnswer(request.getPhase()));
        doThrow(new TransientFailureException("push failed: remote end hung up unexpectedly"))
            .when(git).pushEmptyBranch(eq(CHECKOUT), anyString(), anyString());

        TaskReport report = runner.run(task);

        assertEquals(FAILED, report.getFinalPhase());
        verify(git, times(4)).pushEmptyBranch(eq(CHECKOUT), anyString(), anyString());
        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)), slept);
        verify(publisher, never()).createDraft(anyString(), anyString(), anyString());
        verify(thread).postFailure(task, "push failed: remote end hung up unexpectedly");
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldRecoverWhenTransientFailureClearsOnRetry() {
        agentAnswers(request -> defaultAnswer(request.getPhase()));
        when(publisher.createDraft(anyString(), anyString(), anyString()))
            .thenThrow(new TransientFailureException("create draft PR failed: HTTP 502"))
            .thenReturn(PR);

        TaskReport report = runner.run(task);

        assertEquals(READY, report.getFinalPhase());
        assertEquals(List.of(Duration.ofSeconds(60)), slept);
    }

    @Test
    void shouldFoldThreadFeedbackIntoNextPrompt() {
        agentAnswers(request -> {
            if (request.getPhase() == PLANNING) {
                relay.recordMessage(THREAD, FeedbackMessage.builder()
                    .userId("U2").userName("Bob").text("use Tailwind").timestamp(NOW).build());
            }
            return defaultAnswer(request.getPhase());
        });

        runner.run(task);

        ArgumentCaptor<AgentRequest> requests = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agent, atLeastOnce()).invoke(requests.capture());
        AgentRequest implementing = requests.getAllValues().stream()
            .filter(request -> request.getPhase() == IMPLEMENTING)
            .findFirst()
            .orElseThrow();
        assertTrue(implementing.getPrompt().contains("Bob: use Tailwind"));
        verify(thread).postFeedbackAcknowledged(eq(task), argThat(messages -> messages.size() == 1));

        AgentRequest review = requests.getAllValues().stream()
            .filter(request -> request.getPhase() == SELF_REVIEW)
            .findFirst()
            .orElseThrow();
        assertFalse(review.getPrompt().contains("use Tailwind"));
    }

    @Test
    void shouldAskQuestionAndPassAnswerToAgent() {
        List<String> planningPrompts = new ArrayList<>();
        agentAnswers(request -> {
            if (request.getPhase() == PLANNING) {
                planningPrompts.add(request.getPrompt());
                if (planningPrompts.size() == 1) {
                    return ResponseParser.parse("QUESTION: Per IP or per account?");
                }
            }
            return defaultAnswer(request.getPhase());
        });
        doAnswer(invocation -> relay.recordMessage(THREAD, FeedbackMessage.builder()
                .userId("U1").userName("Alice").text("per account").timestamp(NOW).build()))
            .when(thread).postQuestion(task, "Per IP or per account?");

        TaskReport report = runner.run(task);

        assertEquals(READY, report.getFinalPhase());
        assertEquals(2, planningPrompts.size());
        assertTrue(planningPrompts.get(1).contains("The human answered: per account"));
        verify(thread, never()).postFeedbackAcknowledged(any(), anyList());
    }

    @Test
    void shouldReleaseDogWhenAgentCrashes() {
        when(agent.invoke(any())).thenThrow(new IllegalStateException("boom"));

        TaskReport report = runner.run(task);

        assertEquals(FAILED, report.getFinalPhase());
        assertEquals("boom", report.getFailureCause());
        assertTrue(report.getCompletedPhases().isEmpty());
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldRecordProgressSnapshot() {
        agentAnswers(request -> {
            if (request.getPhase() == IMPLEMENTING) {
                assertEquals(IMPLEMENTING, cancellation.lastProgress(TASK_ID).orElseThrow().getPhase());
                assertEquals(PR.getUrl(), cancellation.lastProgress(TASK_ID).orElseThrow().getPrUrl());
            }
            return defaultAnswer(request.getPhase());
        });

        runner.run(task);

        assertEquals(READY, cancellation.lastProgress(TASK_ID).orElseThrow().getPhase());
    }

    @Test
    void shouldFailAndTellThreadWhenStoreIsLostAtCheckpoint() {
        agentAnswers(request -> {
            if (request.getPhase() == PLANNING) {
                store.down = true;
            }
            return defaultAnswer(request.getPhase());
        });

        TaskReport report = runner.run(task);

        assertEquals(FAILED, report.getFinalPhase());
        assertEquals(List.of(PLANNING), report.getCompletedPhases());
        assertEquals("redis down", report.getFailureCause());
        verify(thread).postFailure(task, "redis down");
        verify(publisher, never()).createDraft(anyString(), anyString(), anyString());
        verify(git).cleanup(CHECKOUT);

        store.down = false;
        assertEquals(0, registry.getActiveTaskCount("Coregi"));
    }

    @Test
    void shouldHonourCancelRequestedEarlyInLongPhase() {
        agentAnswers(request -> {
            if (request.getPhase() == IMPLEMENTING) {
                cancellation.requestCancel(TASK_ID, "Alice", "U1");
                clock.advance(Duration.ofMinutes(65));
            }
            return defaultAnswer(request.getPhase());
        });

        TaskReport report = runner.run(task);

        assertEquals(CANCELLED, report.getFinalPhase());
        assertEquals(List.of(PLANNING, DRAFT_OPENED, IMPLEMENTING), report.getCompletedPhases());
        verify(publisher, never()).markReady(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldAcknowledgeOnlyNewlyReadFeedback() {
        agentAnswers(request -> {
            if (request.getPhase() == PLANNING) {
                relay.recordMessage(THREAD, FeedbackMessage.builder()
                    .userId("U2").userName("Bob").text("use Tailwind").timestamp(NOW).build());
            }
            return defaultAnswer(request.getPhase());
        });
        when(publisher.createDraft(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            relay.recordMessage(THREAD, FeedbackMessage.builder()
                .userId("U3").userName("Carol").text("keep the limit at 5").timestamp(NOW).build());
            return PR;
        });

        runner.run(task);

        ArgumentCaptor<List<FeedbackMessage>> acknowledged = ArgumentCaptor.forClass(List.class);
        verify(thread, times(2)).postFeedbackAcknowledged(eq(task), acknowledged.capture());
        assertEquals("use Tailwind", acknowledged.getAllValues().get(0).get(0).getText());
        assertEquals(1, acknowledged.getAllValues().get(1).size());
        assertEquals("keep the limit at 5", acknowledged.getAllValues().get(1).get(0).getText());

        ArgumentCaptor<AgentRequest> requests = ArgumentCaptor.forClass(AgentRequest.class);
        verify(agent, atLeastOnce()).invoke(requests.capture());
        String implementing = requests.getAllValues().stream()
            .filter(request -> request.getPhase() == IMPLEMENTING)
            .findFirst()
            .orElseThrow()
            .getPrompt();
        assertTrue(implementing.contains("Bob: use Tailwind"));
        assertTrue(implementing.contains("Carol: keep the limit at 5"));
    }

    /** In-memory store whose reads can be made to fail. */
    private static class SwitchableStore extends InMemoryCoordinationStore {
        volatile boolean down;

        SwitchableStore(Clock clock) {
            super(clock);
        }

        @Override
        public Optional<String> get(String key) {
            if (down) {
                throw new StoreUnavailableException("redis down", null);
            }
            return super.get(key);
        }
    }

    private void agentAnswers(Function<AgentRequest, AgentResponse> answers) {
        when(agent.invoke(any())).thenAnswer(invocation -> answers.apply(invocation.getArgument(0)));
    }

    private static AgentResponse defaultAnswer(TaskPhase phase) {
        return switch (phase) {
            case PLANNING -> ResponseParser.parse("TITLE: Add rate limiting\n- Add a limiter to LoginController");
            case IMPLEMENTING -> ResponseParser.parse("Added a token bucket in front of /api/login.");
            case SELF_REVIEW -> ResponseParser.parse("- Check the limit value");
            case TESTING -> ResponseParser.parse("Added LoginRateLimitTest.\nTESTS: PASSED");
            default -> throw new IllegalArgumentException(phase.name());
        };
    }
}
