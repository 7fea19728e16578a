package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.TaskMessage;
import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.TaskSummary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Markdown bodies for the task's pull request: draft, final and cancelled.
 */
@Component
public class PullRequestBodyFormatter {

    private static final DateTimeFormatter REQUEST_TIME =
        DateTimeFormatter.ofPattern("MMMM dd, yyyy 'at' hh:mm:ss a z", Locale.US);

    private static final String FOOTER = "---\n🤖 Generated with Dogwalker\n";

    @Value("${dogwalker.pr.timezone:America/Los_Angeles}")
    private String timezone = "America/Los_Angeles";

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String draftBody(TaskMessage task, String plan) {
        return header(task)
            + "### 🎯 Implementation Plan\n" + orDefault(plan) + "\n\n"
            + "---\n\n"
            + "🚧 **This is a draft PR** - Implementation in progress...\n\n"
            + "_This PR will be updated with changes and marked ready for review when complete._\n\n"
            + FOOTER;
    }

    public String finalBody(TaskMessage task, TaskSummary summary, Duration duration) {
        StringBuilder body = new StringBuilder(header(task));
        body.append("### 🎯 Implementation Plan\n").append(orDefault(summary.getPlan())).append("\n\n");
        appendFiles(body, summary.getFilesTouched());

        String review = summary.getReviewNotes();
        if (review != null && !review.isBlank() && !review.strip().equalsIgnoreCase("none")) {
            body.append("### ⚠️ Critical Review Areas\n").append(review.strip()).append("\n\n");
        }

        body.append("### ✅ Tests\n").append(testLine(summary)).append("\n\n");
        String testOutput = summary.getTestOutput();
        if (testOutput != null && !testOutput.isBlank()) {
            body.append("<details>\n<summary>Test notes</summary>\n\n")
                .append(testOutput.strip()).append("\n\n</details>\n\n");
        }

        String feedback = summary.getFeedbackTranscript();
        if (feedback != null && !feedback.isBlank()) {
            body.append("### 💬 Thread Feedback\n")
                .append("Feedback received in Slack while this task was in progress:\n")
                .append(feedback).append("\n\n");
        }

        body.append("### ⏱️ Task Duration\nCompleted in **").append(formatDuration(duration)).append("**\n\n");
        body.append(FOOTER);
        return body.toString();
    }

    public String cancelledBody(TaskMessage task, TaskSummary summary, String cancelledBy, Duration elapsed) {
        StringBuilder body = new StringBuilder(header(task));
        body.append("### 🎯 Implementation Plan\n").append(orDefault(summary.getPlan())).append("\n\n");
        appendFiles(body, summary.getFilesTouched());
        body.append("### 🛑 Cancelled\n")
            .append("Cancelled by **").append(cancelledBy).append("** after ")
            .append(formatDuration(elapsed)).append(".\n\n")
            .append("Completed: ").append(phaseList(summary.getCompletedPhases())).append("\n\n")
            .append("Not completed: ").append(phaseList(summary.getPendingPhases())).append("\n\n");
        body.append(FOOTER);
        return body.toString();
    }

    public static String formatDuration(Duration duration) {
        long minutes = duration.toMinutes();
        long seconds = duration.toSecondsPart();
        if (minutes > 0) {
            return plural(minutes, "minute") + " and " + plural(seconds, "second");
        }
        return plural(seconds, "second");
    }

    public static String phaseList(List<TaskPhase> phases) {
        if (phases.isEmpty()) {
            return "_none_";
        }
        return phases.stream().map(TaskPhase::label).collect(Collectors.joining(", "));
    }

    private String header(TaskMessage task) {
        String requester = task.getRequesterProfileUrl() != null
            ? "[" + task.getRequesterName() + "](" + task.getRequesterProfileUrl() + ")"
            : task.getRequesterName();
        String when = task.getStartTime() == null ? "unknown"
            : REQUEST_TIME.format(task.getStartTime().atZone(ZoneId.of(timezone)));

        return "## 🐕 Dogwalker AI Task Report\n\n"
            + "### 👤 Requester\n**" + requester + "** requested this change\n\n"
            + "### 📋 Request\n> " + task.getTaskDescription() + "\n\n"
            + "### 📅 When\nRequested on **" + when + "**\n\n";
    }

    private static void appendFiles(StringBuilder body, List<String> files) {
        body.append("### 📝 Changes Made\n");
        if (files.isEmpty()) {
            body.append("_No file changes yet_\n\n");
            return;
        }
        body.append("The following files were modified:\n");
        files.forEach(file -> body.append("- `").append(file).append("`\n"));
        body.append("\n");
    }

    private static String testLine(TaskSummary summary) {
        if (summary.getTestsPassed() == null) {
            return "_Test result unknown_";
        }
        return summary.getTestsPassed() ? "All tests passed" : "**Tests failed** - see the test notes below";
    }

    private static String orDefault(String plan) {
        return plan == null || plan.isBlank() ? "_AI agent autonomously determined the implementation approach_" : plan;
    }

    private static String plural(long count, String unit) {
        return count + " " + unit + (count == 1 ? "" : "s");
    }
}
