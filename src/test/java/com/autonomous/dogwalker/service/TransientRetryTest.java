package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.TaskValidationException;
import com.autonomous.dogwalker.exception.TransientFailureException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TransientRetryTest {

    private final List<Duration> slept = new ArrayList<>();
    private final TransientRetry retry = TransientRetry.withBackoffs(
        List.of(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)), slept::add);

    @Test
    void shouldReturnFirstSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retry.call("push", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientFailureException("timed out");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(120)), slept);
    }

    @Test
    void shouldGiveUpAfterThreeRetries() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(TransientFailureException.class, () -> retry.run("push", () -> {
            attempts.incrementAndGet();
            throw new TransientFailureException("timed out");
        }));

        assertEquals(4, attempts.get());
        assertEquals(3, slept.size());
    }

    @Test
    void shouldNotRetryOtherFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(TaskValidationException.class, () -> retry.run("push", () -> {
            attempts.incrementAndGet();
            throw new TaskValidationException("auth rejected");
        }));

        assertEquals(1, attempts.get());
        assertTrue(slept.isEmpty());
    }

    @Test
    void shouldRetryIoFailures() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retry.call("update PR body", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new UncheckedIOException(new IOException("connection reset"));
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(Duration.ofSeconds(60)), slept);
    }

    @Test
    void shouldNotRetryProgrammingErrors() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> retry.run("push", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    void shouldReadScheduleFromSeconds() {
        TransientRetry configured = new TransientRetry(List.of(1L, 2L));
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(TaskValidationException.class, () -> configured.run("noop", () -> {
            attempts.incrementAndGet();
            throw new TaskValidationException("no");
        }));
        assertEquals(1, attempts.get());
    }
}
