package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.TransientFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Retries remote operations that fail with a transient signature (see
 * {@link ErrorClassifier#isTransient}). With the
 * default schedule an operation is tried once and retried after 60s, 120s
 * and 240s before the failure is passed on.
 */
@Component
public class TransientRetry {

    private static final Logger log = LoggerFactory.getLogger(TransientRetry.class);

    /** Sleeps between attempts. Replaced in tests. */
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private List<Duration> backoffs;
    private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

    public TransientRetry(@Value("${dogwalker.retry.backoff-seconds:60,120,240}") List<Long> backoffSeconds) {
        this.backoffs = backoffSeconds.stream().map(Duration::ofSeconds).toList();
    }

    public static TransientRetry withBackoffs(List<Duration> backoffs, Sleeper sleeper) {
        TransientRetry retry = new TransientRetry(List.of());
        retry.backoffs = List.copyOf(backoffs);
        retry.sleeper = sleeper;
        return retry;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!ErrorClassifier.isTransient(e)) {
                    throw e;
                }
                if (attempt >= backoffs.size()) {
                    log.error("{} failed after {} retries: {}", operation, backoffs.size(), e.getMessage());
                    throw e;
                }
                Duration backoff = backoffs.get(attempt);
                attempt++;
                log.warn("{} failed ({}), retry {}/{} in {}s",
                    operation, e.getMessage(), attempt, backoffs.size(), backoff.toSeconds());
                pause(backoff, e);
            }
        }
    }

    private void pause(Duration backoff, RuntimeException cause) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFailureException("Interrupted while waiting to retry", cause);
        }
    }
}
