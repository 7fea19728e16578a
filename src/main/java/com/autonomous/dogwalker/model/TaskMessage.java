package com.autonomous.dogwalker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Payload handed from the entry point to the worker pool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage {
    @JsonProperty("task_id")
    private String taskId;
    @JsonProperty("task_description")
    private String taskDescription;
    @JsonProperty("branch_name")
    private String branchName;
    @JsonProperty("agent_name")
    private String agentName;
    @JsonProperty("agent_display_name")
    private String agentDisplayName;
    @JsonProperty("agent_email")
    private String agentEmail;
    @JsonProperty("thread_ts")
    private String threadTs;
    @JsonProperty("channel_id")
    private String channelId;
    @JsonProperty("requester_name")
    private String requesterName;
    @JsonProperty("requester_profile_url")
    private String requesterProfileUrl;
    @JsonProperty("start_time")
    private Instant startTime;
}
