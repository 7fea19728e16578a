package com.autonomous.dogwalker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A human message posted in a thread while a dog works on it. The sequence
 * number is the 1-based position in the thread's log and is not serialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackMessage {
    @JsonIgnore
    private long sequence;
    @JsonProperty("user_id")
    private String userId;
    @JsonProperty("user_name")
    private String userName;
    private String text;
    private Instant timestamp;
    @JsonProperty("message_ts")
    private String messageTs;
}
