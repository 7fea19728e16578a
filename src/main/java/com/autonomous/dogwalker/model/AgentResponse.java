package com.autonomous.dogwalker.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AgentResponse {
    String output;
    String title;
    String question;
    Boolean testsPassed;

    public boolean hasQuestion() {
        return question != null && !question.isBlank();
    }
}
