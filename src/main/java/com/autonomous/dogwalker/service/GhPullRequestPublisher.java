package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.PullRequestRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Pull requests through the GitHub CLI.
 */
@Service
public class GhPullRequestPublisher implements PullRequestPublisher {

    private static final Logger log = LoggerFactory.getLogger(GhPullRequestPublisher.class);

    private static final Duration GH_TIMEOUT = Duration.ofMinutes(2);

    private final CommandRunner commands;

    @Value("${dogwalker.repo.slug:}")
    private String repoSlug;

    @Value("${dogwalker.repo.base-branch:main}")
    private String baseBranch = "main";

    public GhPullRequestPublisher(CommandRunner commands) {
        this.commands = commands;
    }

    @Override
    public PullRequestRef createDraft(String branch, String title, String body) {
        CommandRunner.Result result = gh("create draft PR", List.of(
            "gh", "pr", "create", "--draft",
            "--repo", repoSlug,
            "--base", baseBranch,
            "--head", branch,
            "--title", title,
            "--body", body));

        String url = result.getOutput().strip().lines()
            .filter(line -> line.startsWith("https://"))
            .reduce((first, second) -> second)
            .orElse(result.getOutput().strip());
        log.info("Opened draft PR {}", url);
        return new PullRequestRef(url, title);
    }

    @Override
    public void updateBody(PullRequestRef pullRequest, String body) {
        gh("update PR body", List.of("gh", "pr", "edit", pullRequest.getUrl(), "--repo", repoSlug, "--body", body));
        log.info("Updated body of {}", pullRequest.getUrl());
    }

    @Override
    public void markReady(PullRequestRef pullRequest) {
        gh("mark PR ready", List.of("gh", "pr", "ready", pullRequest.getUrl(), "--repo", repoSlug));
        log.info("Marked {} ready for review", pullRequest.getUrl());
    }

    @Override
    public boolean branchExists(String branch) {
        CommandRunner.Result result = commands.run(null, GH_TIMEOUT,
            List.of("gh", "api", "repos/" + repoSlug + "/git/ref/heads/" + branch));
        if (result.isSuccess()) {
            return true;
        }
        String output = result.getOutput().toLowerCase(Locale.ROOT);
        if (output.contains("not found") || output.contains("404")) {
            return false;
        }
        throw ErrorClassifier.forCommandFailure("branch lookup", result.getOutput());
    }

    private CommandRunner.Result gh(String operation, List<String> command) {
        CommandRunner.Result result = commands.run(null, GH_TIMEOUT, command);
        if (!result.isSuccess()) {
            throw ErrorClassifier.forCommandFailure(operation, result.getOutput());
        }
        return result;
    }
}
