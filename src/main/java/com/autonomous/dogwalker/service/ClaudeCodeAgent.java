package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.AgentRequest;
import com.autonomous.dogwalker.model.AgentResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the Claude Code CLI in print mode inside the task checkout.
 */
@Service
public class ClaudeCodeAgent implements CodingAgent {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCodeAgent.class);

    private final CommandRunner commands;

    @Value("${dogwalker.claude.path:claude}")
    private String claudeCodePath = "claude";

    @Value("${dogwalker.claude.model:sonnet}")
    private String model = "sonnet";

    @Value("${dogwalker.claude.timeout-minutes:30}")
    private long timeoutMinutes = 30;

    public ClaudeCodeAgent(CommandRunner commands) {
        this.commands = commands;
    }

    @Override
    public AgentResponse invoke(AgentRequest request) {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("--print");
        command.add("--dangerously-skip-permissions");
        command.add("--model");
        command.add(model);
        command.add(request.getPrompt());

        log.info("Running Claude Code for {} ({} chars of prompt)", request.getPhase(), request.getPrompt().length());
        long started = System.currentTimeMillis();
        CommandRunner.Result result = commands.run(
            request.getWorkingDirectory(), Duration.ofMinutes(timeoutMinutes), command);

        if (!result.isSuccess()) {
            throw ErrorClassifier.forCommandFailure("Claude Code", result.getOutput());
        }
        log.info("Claude Code finished {} in {}s", request.getPhase(), (System.currentTimeMillis() - started) / 1000);
        return ResponseParser.parse(result.getOutput());
    }
}
