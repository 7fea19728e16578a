package com.autonomous.dogwalker.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DogStatus {
    private String name;
    private String email;
    private long activeTasks;
}
