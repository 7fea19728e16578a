package com.autonomous.dogwalker.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DogRoster {
    private List<Dog> dogs = new ArrayList<>();
}
