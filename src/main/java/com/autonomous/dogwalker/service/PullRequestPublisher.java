package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.PullRequestRef;

/**
 * Source-hosting side of a task: the pull request and its branch.
 */
public interface PullRequestPublisher {

    PullRequestRef createDraft(String branch, String title, String body);

    void updateBody(PullRequestRef pullRequest, String body);

    void markReady(PullRequestRef pullRequest);

    boolean branchExists(String branch);
}
