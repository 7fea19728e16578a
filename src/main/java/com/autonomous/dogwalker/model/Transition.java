package com.autonomous.dogwalker.model;

import lombok.Value;

import java.util.List;

@Value
public class Transition {
    TaskPhase target;
    List<TaskEffect> effects;

    public static Transition to(TaskPhase target, TaskEffect... effects) {
        return new Transition(target, List.of(effects));
    }
}
