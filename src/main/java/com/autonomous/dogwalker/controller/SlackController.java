package com.autonomous.dogwalker.controller;

import com.autonomous.dogwalker.model.DogStatus;
import com.autonomous.dogwalker.model.FeedbackMessage;
import com.autonomous.dogwalker.model.MentionEvent;
import com.autonomous.dogwalker.model.RecordOutcome;
import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.TaskProgress;
import com.autonomous.dogwalker.service.CancellationService;
import com.autonomous.dogwalker.service.ChatGateway;
import com.autonomous.dogwalker.service.DogRegistryService;
import com.autonomous.dogwalker.service.FeedbackRelayService;
import com.autonomous.dogwalker.service.TaskEntryService;
import com.autonomous.dogwalker.service.ThreadManagerService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/slack")
public class SlackController {

    private static final Logger log = LoggerFactory.getLogger(SlackController.class);

    private final TaskEntryService entry;
    private final FeedbackRelayService relay;
    private final CancellationService cancellation;
    private final DogRegistryService registry;
    private final ThreadManagerService thread;
    private final ChatGateway chat;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SlackController(TaskEntryService entry, FeedbackRelayService relay, CancellationService cancellation,
                           DogRegistryService registry, ThreadManagerService thread, ChatGateway chat,
                           ObjectMapper mapper, Clock clock) {
        this.entry = entry;
        this.relay = relay;
        this.cancellation = cancellation;
        this.registry = registry;
        this.thread = thread;
        this.chat = chat;
        this.mapper = mapper;
        this.clock = clock;
    }

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody JsonNode payload,
                                              @RequestHeader(value = "X-Slack-Retry-Num", required = false) String retryNum) {
        if ("url_verification".equals(payload.path("type").asText())) {
            return ResponseEntity.ok(Map.of("challenge", payload.path("challenge").asText()));
        }
        if (retryNum != null) {
            log.debug("Ignoring Slack retry #{}", retryNum);
            return ResponseEntity.ok().build();
        }

        JsonNode event = payload.path("event");
        switch (event.path("type").asText()) {
            case "app_mention" -> handleMention(event);
            case "message" -> handleThreadMessage(event);
            default -> log.debug("Ignoring event type {}", event.path("type").asText());
        }
        return ResponseEntity.ok().build();
    }

    private void handleMention(JsonNode event) {
        String userId = event.path("user").asText(null);
        String threadTs = event.hasNonNull("thread_ts") ? event.get("thread_ts").asText() : event.path("ts").asText();

        entry.accept(MentionEvent.builder()
            .text(event.path("text").asText(""))
            .requesterId(userId)
            .requesterDisplayName(userId == null ? "Unknown User" : chat.displayName(userId))
            .channelId(event.path("channel").asText())
            .threadTs(threadTs)
            .build());
    }

    /**
     * Human replies inside a thread become feedback for the task bound to it.
     */
    private void handleThreadMessage(JsonNode event) {
        if (!event.hasNonNull("thread_ts")
                || event.hasNonNull("bot_id")
                || event.hasNonNull("subtype")
                || event.path("text").asText("").isBlank()) {
            return;
        }
        // Mentions arrive separately as app_mention
        String text = event.path("text").asText();
        if (text.strip().startsWith("<@")) {
            return;
        }

        String userId = event.path("user").asText(null);
        String threadTs = event.get("thread_ts").asText();
        String messageTs = event.path("ts").asText();

        FeedbackMessage message = FeedbackMessage.builder()
            .userId(userId)
            .userName(userId == null ? "Unknown User" : chat.displayName(userId))
            .text(text)
            .timestamp(clock.instant())
            .messageTs(messageTs)
            .build();

        RecordOutcome outcome = relay.recordMessage(threadTs, message);
        if (outcome.isRecorded()) {
            chat.react(event.path("channel").asText(), messageTs, "eyes");
        } else {
            log.warn("Dropped message in thread {}: no active task", threadTs);
        }
    }

    @PostMapping("/actions")
    public ResponseEntity<?> handleAction(@RequestParam("payload") String payloadJson) {
        JsonNode payload;
        try {
            payload = mapper.readTree(payloadJson);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable interaction payload: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().build();
        }
        if (!"block_actions".equals(payload.path("type").asText())) {
            return ResponseEntity.ok().build();
        }

        for (JsonNode action : payload.path("actions")) {
            if (ThreadManagerService.CANCEL_ACTION_ID.equals(action.path("action_id").asText())) {
                handleCancel(payload, action.path("value").asText());
            }
        }
        return ResponseEntity.ok().build();
    }

    private void handleCancel(JsonNode payload, String taskId) {
        String userId = payload.path("user").path("id").asText(null);
        String userName = userId == null ? "Unknown User" : chat.displayName(userId);
        String channelId = payload.path("channel").path("id").asText();
        String threadTs = relay.threadForTask(taskId)
            .orElse(payload.path("container").path("thread_ts").asText(payload.path("message").path("ts").asText()));

        Optional<TaskPhase> phase = cancellation.lastProgress(taskId).map(TaskProgress::getPhase);
        if (phase.isPresent() && phase.get().isTerminal()) {
            thread.postUpdate(channelId, threadTs, "This task has already finished (" + phase.get().label() + ").");
            return;
        }

        if (cancellation.requestCancel(taskId, userName, userId)) {
            thread.postCancellationRequested(channelId, threadTs, userName, phase.orElse(null));
        } else {
            thread.postUpdate(channelId, threadTs, "Cancellation was already requested for this task.");
        }
    }

    @PostMapping("/slash-commands")
    public ResponseEntity<?> handleSlashCommand(@RequestParam Map<String, String> params) {
        String command = params.getOrDefault("command", "");

        String response = switch (command) {
            case "/dogwalker-status" -> handleStatus();
            default -> "Unknown command: " + command;
        };

        return ResponseEntity.ok(Map.of(
            "response_type", "ephemeral",
            "text", response
        ));
    }

    private String handleStatus() {
        StringBuilder status = new StringBuilder("*Dog status*\n");
        for (DogStatus dog : registry.getDogStatus()) {
            status.append("• ").append(dog.getName()).append(": ")
                .append(dog.getActiveTasks()).append(dog.getActiveTasks() == 1 ? " active task" : " active tasks")
                .append("\n");
        }
        if (registry.isDegraded()) {
            status.append("_Coordination store unreachable: assigning round-robin._");
        }
        return status.toString().strip();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
