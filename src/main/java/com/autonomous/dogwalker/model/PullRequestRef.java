package com.autonomous.dogwalker.model;

import lombok.Value;

@Value
public class PullRequestRef {
    String url;
    String title;
}
