package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.FeedbackMessage;
import com.autonomous.dogwalker.model.PullRequestRef;
import com.autonomous.dogwalker.model.TaskMessage;
import com.autonomous.dogwalker.model.TaskPhase;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything a dog says in a task's Slack thread.
 */
@Service
public class ThreadManagerService {

    public static final String CANCEL_ACTION_ID = "cancel_task";

    private static final int PLAN_PREVIEW_LENGTH = 350;

    private final ChatGateway chat;

    public ThreadManagerService(ChatGateway chat) {
        this.chat = chat;
    }

    public void postUpdate(String channelId, String threadTs, String message) {
        chat.post(channelId, threadTs, message, null);
    }

    public void postUsageHint(String channelId, String threadTs) {
        postUpdate(channelId, threadTs,
            "Please provide a task description! Example: `@dogwalker add rate limiting to /api/login`");
    }

    public void postStarted(TaskMessage task) {
        String text = String.format("*%s* is taking this task!\n\n_%s_",
            task.getAgentDisplayName(), task.getTaskDescription());
        chat.postWithButton(task.getChannelId(), task.getThreadTs(), text,
            CANCEL_ACTION_ID, "Cancel Task", task.getTaskId());
    }

    public void postAlreadyWorking(String channelId, String threadTs) {
        postUpdate(channelId, threadTs,
            "A dog is already working on a task in this thread. Start a new thread for a new task.");
    }

    public void postDraftCreated(TaskMessage task, PullRequestRef pr, String plan) {
        String preview = plan == null ? "" : plan.strip();
        if (preview.length() > PLAN_PREVIEW_LENGTH) {
            preview = preview.substring(0, PLAN_PREVIEW_LENGTH) + "...";
        }
        String text = String.format("*%s created a draft PR with the plan*\n\n<%s|%s>\n\n*Plan preview:*\n```\n%s\n```\n\n_Now implementing the changes..._",
            task.getAgentDisplayName(), pr.getUrl(), pr.getTitle(), preview);
        chat.post(task.getChannelId(), task.getThreadTs(), text, "📋");
    }

    public void postPhase(TaskMessage task, TaskPhase phase) {
        chat.post(task.getChannelId(), task.getThreadTs(), "Starting " + phase.label() + "...", "🔄");
    }

    public void postFeedbackAcknowledged(TaskMessage task, List<FeedbackMessage> messages) {
        String senders = messages.stream()
            .map(FeedbackMessage::getUserName)
            .distinct()
            .collect(Collectors.joining(", "));
        String text = String.format("Got it! Incorporating feedback from %s before %s continues.",
            senders, task.getAgentDisplayName());
        chat.post(task.getChannelId(), task.getThreadTs(), text, "👍");
    }

    public void postQuestion(TaskMessage task, String question) {
        String text = String.format("*Question:* %s\n\n_Please reply in this thread. I'll check back shortly._", question);
        chat.post(task.getChannelId(), task.getThreadTs(), text, "❓");
    }

    public void postCompletion(TaskMessage task, PullRequestRef pr) {
        String text = String.format("*Work complete! PR ready for review*\n\n<%s|%s>\n\n_Completed by %s_",
            pr.getUrl(), pr.getTitle(), task.getAgentDisplayName());
        chat.post(task.getChannelId(), task.getThreadTs(), text, "✅");
    }

    public void postFailure(TaskMessage task, String cause) {
        String text = String.format("*Task failed*\n\n```%s```", cause);
        chat.post(task.getChannelId(), task.getThreadTs(), text, "❌");
    }

    public void postCancelled(TaskMessage task, String cancelledBy, List<TaskPhase> completed, PullRequestRef pr) {
        StringBuilder text = new StringBuilder();
        text.append("*Task cancelled by ").append(cancelledBy).append("*\n\n");
        if (completed.isEmpty()) {
            text.append("_").append(task.getAgentDisplayName()).append(" stopped before making changes._\n\n");
        } else {
            text.append("_").append(task.getAgentDisplayName()).append(" completed: ")
                .append(PullRequestBodyFormatter.phaseList(completed)).append("_\n\n");
        }
        if (pr != null) {
            text.append("Draft PR with partial progress: <").append(pr.getUrl()).append("|View PR>");
        } else {
            text.append("No PR was created.");
        }
        chat.post(task.getChannelId(), task.getThreadTs(), text.toString(), "🛑");
    }

    public void postCancellationRequested(String channelId, String threadTs, String cancelledBy, TaskPhase phase) {
        String where = phase == null ? "" : " after " + phase.label();
        postUpdate(channelId, threadTs, String.format(
            "*Cancellation requested by %s*\n\n_The dog will stop at the next safe checkpoint%s..._", cancelledBy, where));
    }
}
