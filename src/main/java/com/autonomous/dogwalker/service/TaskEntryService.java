package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.AlreadyBoundException;
import com.autonomous.dogwalker.exception.DogwalkerException;
import com.autonomous.dogwalker.exception.NoAgentsConfiguredException;
import com.autonomous.dogwalker.model.Dog;
import com.autonomous.dogwalker.model.MentionEvent;
import com.autonomous.dogwalker.model.TaskMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns a mention into a queued task: picks a dog, binds the thread, names
 * the branch and hands the task to the worker pool.
 */
@Service
public class TaskEntryService {

    private static final Logger log = LoggerFactory.getLogger(TaskEntryService.class);

    private static final Pattern MENTION = Pattern.compile("<@[A-Z0-9]+(\\|[^>]*)?>");
    private static final int MAX_BRANCH_ATTEMPTS = 10;

    private final DogRegistryService registry;
    private final FeedbackRelayService relay;
    private final ThreadManagerService thread;
    private final PullRequestPublisher publisher;
    private final GitService git;
    private final TaskQueue queue;
    private final Clock clock;

    @Value("${dogwalker.slack.workspace-url:https://slack.com}")
    private String workspaceUrl = "https://slack.com";

    public TaskEntryService(DogRegistryService registry, FeedbackRelayService relay, ThreadManagerService thread,
                            PullRequestPublisher publisher, GitService git, TaskQueue queue, Clock clock) {
        this.registry = registry;
        this.relay = relay;
        this.thread = thread;
        this.publisher = publisher;
        this.git = git;
        this.queue = queue;
        this.clock = clock;
    }

    public void setWorkspaceUrl(String workspaceUrl) {
        this.workspaceUrl = workspaceUrl;
    }

    /**
     * @return the queued task, or empty if the mention did not start one
     */
    public Optional<TaskMessage> accept(MentionEvent event) {
        String description = stripMentions(event.getText());
        if (description.isEmpty()) {
            thread.postUsageHint(event.getChannelId(), event.getThreadTs());
            return Optional.empty();
        }

        String taskId = event.getChannelId() + "_" + event.getThreadTs();
        String channelId = event.getChannelId();
        String threadTs = event.getThreadTs();
        try {
            if (relay.taskForThread(threadTs).isPresent()) {
                log.info("Thread {} already has a task, ignoring mention", threadTs);
                thread.postAlreadyWorking(channelId, threadTs);
                return Optional.empty();
            }
        } catch (DogwalkerException e) {
            refuse(channelId, threadTs, taskId, e);
            return Optional.empty();
        }

        Dog dog;
        try {
            dog = registry.assign(taskId);
        } catch (NoAgentsConfiguredException e) {
            log.error("Cannot accept task {}: {}", taskId, e.getMessage());
            thread.postUpdate(channelId, threadTs, "No dogs are available right now. Check the dog roster.");
            return Optional.empty();
        }

        try {
            relay.bind(threadTs, taskId);
        } catch (AlreadyBoundException e) {
            log.info("Lost race for thread {} to task {}", e.getThreadTs(), e.getExistingTaskId());
            registry.markFree(dog, taskId);
            thread.postAlreadyWorking(channelId, threadTs);
            return Optional.empty();
        } catch (DogwalkerException e) {
            registry.markFree(dog, taskId);
            refuse(channelId, threadTs, taskId, e);
            return Optional.empty();
        }

        TaskMessage task = TaskMessage.builder()
            .taskId(taskId)
            .taskDescription(description)
            .branchName(uniqueBranchName(dog, description))
            .agentName(dog.getName())
            .agentDisplayName(dog.getDisplayNameOrName())
            .agentEmail(dog.getEmail())
            .threadTs(threadTs)
            .channelId(channelId)
            .requesterName(event.getRequesterDisplayName())
            .requesterProfileUrl(event.getRequesterId() == null ? null : workspaceUrl + "/team/" + event.getRequesterId())
            .startTime(clock.instant())
            .build();

        thread.postStarted(task);
        try {
            queue.enqueue(task);
        } catch (RuntimeException e) {
            registry.markFree(dog, taskId);
            try {
                relay.unbind(threadTs, taskId);
            } catch (DogwalkerException unbindFailure) {
                log.warn("Could not unbind thread {}: {}", threadTs, unbindFailure.getMessage());
            }
            refuse(channelId, threadTs, taskId, e);
            return Optional.empty();
        }
        log.info("Task {} assigned to {} on branch {}", taskId, dog.getName(), task.getBranchName());
        return Optional.of(task);
    }

    private void refuse(String channelId, String threadTs, String taskId, RuntimeException cause) {
        log.error("Could not queue task {}", taskId, cause);
        thread.postUpdate(channelId, threadTs, "Could not queue the task: " + ErrorClassifier.describe(cause));
    }

    public static String stripMentions(String text) {
        if (text == null) {
            return "";
        }
        return MENTION.matcher(text).replaceAll("").strip().replaceAll("\\s+", " ");
    }

    private String uniqueBranchName(Dog dog, String description) {
        String base = git.generateBranchName(dog.getName(), description);
        String candidate = base;
        try {
            for (int attempt = 2; attempt <= MAX_BRANCH_ATTEMPTS && publisher.branchExists(candidate); attempt++) {
                candidate = base + "-" + attempt;
            }
        } catch (DogwalkerException e) {
            log.warn("Branch lookup failed ({}), using {}", e.getMessage(), candidate);
        }
        return candidate;
    }
}
