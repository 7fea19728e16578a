package com.autonomous.dogwalker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationInfo {
    @JsonProperty("cancelled_by")
    private String cancelledBy;
    @JsonProperty("cancelled_by_id")
    private String cancelledById;
    @JsonProperty("requested_at")
    private Instant requestedAt;
}
