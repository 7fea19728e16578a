package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.DogwalkerException;
import com.autonomous.dogwalker.exception.TransientFailureException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands (git, gh, claude) and collects their combined output.
 */
@Component
public class CommandRunner {

    private static final Duration OUTPUT_GRACE = Duration.ofSeconds(10);

    private final Executor outputReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "command-output");
        thread.setDaemon(true);
        return thread;
    });

    public static class Result {
        private final int exitCode;
        private final String output;

        public Result(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output;
        }

        public int getExitCode() { return exitCode; }
        public String getOutput() { return output; }
        public boolean isSuccess() { return exitCode == 0; }
    }

    public Result run(Path workDir, Duration timeout, List<String> command) {
        return run(workDir, timeout, command, Map.of());
    }

    public Result run(Path workDir, Duration timeout, List<String> command, Map<String, String> environment) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().putAll(environment);
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new DogwalkerException("Could not start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // Output is drained off-thread so a silent, hung process still hits the timeout
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readProcessOutput(process), outputReaders);
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new TransientFailureException(command.get(0) + " timed out after " + describe(timeout));
            }
            return new Result(process.exitValue(), output.get(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TransientFailureException(command.get(0) + " was interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransientFailureException("Lost output of " + command.get(0), e);
        }
    }

    private static String describe(Duration timeout) {
        return timeout.toMinutes() > 0 ? timeout.toMinutes() + " minutes" : timeout.toSeconds() + " seconds";
    }

    private static String readProcessOutput(Process process) {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toString();
    }
}
