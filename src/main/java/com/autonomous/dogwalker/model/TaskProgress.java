package com.autonomous.dogwalker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskProgress {
    private TaskPhase phase;
    @Builder.Default
    @JsonProperty("completed_phases")
    private List<TaskPhase> completedPhases = new ArrayList<>();
    @JsonProperty("pr_url")
    private String prUrl;
    @JsonProperty("updated_at")
    private Instant updatedAt;
}
