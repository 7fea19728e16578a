package com.autonomous.dogwalker.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

@Value
@Builder
public class AgentRequest {
    String taskId;
    TaskPhase phase;
    String prompt;
    Path workingDirectory;
    Dog dog;
}
