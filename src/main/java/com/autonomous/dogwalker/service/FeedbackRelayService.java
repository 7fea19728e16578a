package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.AlreadyBoundException;
import com.autonomous.dogwalker.exception.DogwalkerException;
import com.autonomous.dogwalker.model.FeedbackMessage;
import com.autonomous.dogwalker.model.RecordOutcome;
import com.autonomous.dogwalker.store.CoordinationStore;
import com.autonomous.dogwalker.store.StoreKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Carries messages between humans in a thread and the dog working on that
 * thread's task.
 *
 * Each thread has an append-only message log. Each task has a read pointer
 * into its thread's log; the pointer only moves forward and only by the
 * number of messages handed to the dog, so no message is delivered twice
 * and none is skipped.
 */
@Service
public class FeedbackRelayService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackRelayService.class);

    private final CoordinationStore store;
    private final StoreKeys keys;
    private final ObjectMapper mapper;
    private final ScheduledExecutorService poller = Executors.newScheduledThreadPool(1, runnable -> {
        Thread thread = new Thread(runnable, "feedback-poller");
        thread.setDaemon(true);
        return thread;
    });

    @Value("${dogwalker.store.retention-hours:24}")
    private long retentionHours = 24;

    @Value("${dogwalker.feedback.poll-interval-ms:10000}")
    private long pollIntervalMs = 10_000;

    public FeedbackRelayService(CoordinationStore store, StoreKeys keys) {
        this.store = store;
        this.keys = keys;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    // ------------------------------------------------------------------
    // Thread <-> task mapping
    // ------------------------------------------------------------------

    /**
     * Writes both directions of the mapping in one atomic step. Binding a
     * thread to the task it is already bound to is a no-op, which keeps
     * redelivered tasks harmless.
     *
     * @throws AlreadyBoundException if the thread belongs to another task
     */
    public void bind(String threadTs, String taskId) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(keys.threadTask(threadTs), taskId);
        entries.put(keys.taskThread(taskId), threadTs);

        if (store.setAllIfAbsent(entries, retention())) {
            log.info("Bound thread {} to task {}", threadTs, taskId);
            return;
        }

        String existing = store.get(keys.threadTask(threadTs)).orElse(null);
        if (taskId.equals(existing)) {
            log.info("Thread {} already bound to task {}", threadTs, taskId);
            return;
        }
        throw new AlreadyBoundException(threadTs, existing);
    }

    /**
     * Removes the mapping of a task that never started. A thread since bound
     * to a different task keeps that binding.
     */
    public void unbind(String threadTs, String taskId) {
        if (store.get(keys.threadTask(threadTs)).filter(taskId::equals).isPresent()) {
            store.delete(keys.threadTask(threadTs));
        }
        store.delete(keys.taskThread(taskId));
        log.info("Unbound thread {} from task {}", threadTs, taskId);
    }

    public Optional<String> taskForThread(String threadTs) {
        return store.get(keys.threadTask(threadTs));
    }

    public Optional<String> threadForTask(String taskId) {
        return store.get(keys.taskThread(taskId));
    }

    // ------------------------------------------------------------------
    // Inbound messages
    // ------------------------------------------------------------------

    /**
     * Appends a human message to the thread's log if a task is bound to the
     * thread. Returns {@link RecordOutcome#UNBOUND} otherwise.
     */
    public RecordOutcome recordMessage(String threadTs, FeedbackMessage message) {
        Optional<String> taskId = taskForThread(threadTs);
        if (taskId.isEmpty()) {
            log.debug("No active task in thread {}, dropping message", threadTs);
            return RecordOutcome.UNBOUND;
        }

        long sequence = store.append(keys.threadMessages(threadTs), toJson(message), retention());
        log.info("Stored message #{} from {} in thread {} for task {}",
            sequence, message.getUserName(), threadTs, taskId.get());
        return new RecordOutcome(taskId.get(), sequence);
    }

    // ------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------

    /**
     * Messages the task has not seen yet. The read pointer moves past exactly
     * the messages returned.
     */
    public List<FeedbackMessage> peekNew(String taskId) {
        Optional<String> threadTs = threadForTask(taskId);
        if (threadTs.isEmpty()) {
            return List.of();
        }

        String messagesKey = keys.threadMessages(threadTs.get());
        long pointer = store.getLong(keys.readPointer(taskId));
        long length = store.length(messagesKey);
        if (length <= pointer) {
            return List.of();
        }

        List<FeedbackMessage> messages = parse(store.range(messagesKey, pointer, length - 1), pointer);
        store.advance(keys.readPointer(taskId), pointer + messages.size(), retention());
        log.info("Read {} new message(s) for task {}", messages.size(), taskId);
        return messages;
    }

    /**
     * Polls for the next unread message. Completes with empty when the
     * timeout elapses first. Cancelling the returned future stops polling.
     */
    public CompletableFuture<Optional<FeedbackMessage>> awaitNextAsync(String taskId, Duration timeout) {
        CompletableFuture<Optional<FeedbackMessage>> result = new CompletableFuture<>();
        Instant deadline = Instant.now().plus(timeout);

        ScheduledFuture<?> polling = poller.scheduleWithFixedDelay(() -> {
            try {
                Optional<FeedbackMessage> next = takeNext(taskId);
                if (next.isPresent()) {
                    result.complete(next);
                } else if (!Instant.now().isBefore(deadline)) {
                    log.info("No reply for task {} within {}", taskId, timeout);
                    result.complete(Optional.empty());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, 0, Math.max(1, pollIntervalMs), TimeUnit.MILLISECONDS);

        result.whenComplete((message, error) -> polling.cancel(false));
        return result;
    }

    /**
     * Blocks the calling worker until the next message arrives or the timeout
     * elapses. Only for explicit question/answer exchanges.
     */
    public Optional<FeedbackMessage> awaitNext(String taskId, Duration timeout) {
        CompletableFuture<Optional<FeedbackMessage>> pending = awaitNextAsync(taskId, timeout);
        try {
            return pending.get();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new DogwalkerException("Waiting for a reply on task " + taskId + " failed", e.getCause());
        }
    }

    /** Every message in the task's thread, read or not. */
    public List<FeedbackMessage> allMessages(String taskId) {
        return threadForTask(taskId)
            .map(keys::threadMessages)
            .map(messagesKey -> parse(store.range(messagesKey, 0, store.length(messagesKey) - 1), 0))
            .orElse(List.of());
    }

    // ------------------------------------------------------------------
    // Rendering
    // ------------------------------------------------------------------

    /**
     * Turns messages into a directive block that is appended to the next
     * coding-agent prompt.
     */
    public String formatForAgent(List<FeedbackMessage> messages) {
        if (messages.isEmpty()) {
            return "";
        }
        String feedback = messages.stream()
            .map(message -> message.getUserName() + ": " + message.getText())
            .collect(Collectors.joining("\n\n"));

        return "\nIMPORTANT - HUMAN FEEDBACK:\n"
            + "The human has provided the following feedback/change request in the Slack thread:\n\n"
            + feedback + "\n\n"
            + "Please incorporate this feedback into your current work. Adjust your implementation\n"
            + "to match the human's request while maintaining code quality and best practices.\n";
    }

    /**
     * The thread's full history as a markdown list, or empty if nobody wrote anything.
     */
    public String renderForPr(String taskId) {
        return allMessages(taskId).stream()
            .map(message -> "- **" + Optional.ofNullable(message.getUserName()).orElse("Unknown User") + ":** "
                + escapeMarkdown(Optional.ofNullable(message.getText()).orElse("")))
            .collect(Collectors.joining("\n"));
    }

    @PreDestroy
    public void shutdown() {
        poller.shutdownNow();
    }

    private Optional<FeedbackMessage> takeNext(String taskId) {
        Optional<String> threadTs = threadForTask(taskId);
        if (threadTs.isEmpty()) {
            return Optional.empty();
        }
        long pointer = store.getLong(keys.readPointer(taskId));
        List<FeedbackMessage> next = parse(store.range(keys.threadMessages(threadTs.get()), pointer, pointer), pointer);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        store.advance(keys.readPointer(taskId), pointer + 1, retention());
        return Optional.of(next.get(0));
    }

    private List<FeedbackMessage> parse(List<String> raw, long offset) {
        List<FeedbackMessage> messages = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            long sequence = offset + i + 1;
            try {
                FeedbackMessage message = mapper.readValue(raw.get(i), FeedbackMessage.class);
                message.setSequence(sequence);
                messages.add(message);
            } catch (JsonProcessingException e) {
                // keep the slot so the pointer still counts it
                log.error("Unreadable message #{} in thread log: {}", sequence, e.getOriginalMessage());
                messages.add(FeedbackMessage.builder()
                    .sequence(sequence).userName("Unknown User").text("").build());
            }
        }
        return messages;
    }

    private String toJson(FeedbackMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new DogwalkerException("Could not serialize feedback message", e);
        }
    }

    private static String escapeMarkdown(String text) {
        return text.replace("*", "\\*").replace("_", "\\_");
    }

    private Duration retention() {
        return Duration.ofHours(retentionHours);
    }
}
