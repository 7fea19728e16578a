package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.DogwalkerException;
import com.autonomous.dogwalker.exception.TaskValidationException;
import com.autonomous.dogwalker.exception.TransientFailureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sorts failures into transient ones (retry) and ones that need a human.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_LENGTH = 200;

    private static final Pattern TRANSIENT_SIGNATURES = Pattern.compile(
        "rate limit|timed out|timeout|connection reset|connection refused|could not resolve host"
            + "|temporarily unavailable|failed to push some refs|remote end hung up|\\[rejected]"
            + "|\\b(?:http(?:/[\\d.]+)?|status|error)[: ]+50[234]\\b|\\b50[234] (?:bad gateway|service unavailable|gateway time-?out)");

    private static final Pattern AUTH_SIGNATURES = Pattern.compile(
        "authentication failed|bad credentials|permission denied"
            + "|\\b(?:http(?:/[\\d.]+)?|status|error)[: ]+40[13]\\b|\\b40[13] (?:unauthorized|forbidden)");

    private ErrorClassifier() {}

    /**
     * Builds the exception for a failed external command from its output.
     */
    public static DogwalkerException forCommandFailure(String operation, String output) {
        String lower = output == null ? "" : output.toLowerCase(Locale.ROOT);
        String detail = firstLine(output);
        if (AUTH_SIGNATURES.matcher(lower).find()) {
            return new TaskValidationException(operation + " was rejected: " + detail);
        }
        if (TRANSIENT_SIGNATURES.matcher(lower).find()) {
            return new TransientFailureException(operation + " failed: " + detail);
        }
        return new DogwalkerException(operation + " failed: " + detail);
    }

    /** Whether {@link TransientRetry} should try the operation again. */
    public static boolean isTransient(Throwable error) {
        return error instanceof TransientFailureException
            || error instanceof IOException
            || error instanceof UncheckedIOException;
    }

    /**
     * One short line suitable for posting to a human. Never a stack trace.
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return firstLine(message);
    }

    private static String firstLine(String text) {
        if (text == null || text.isBlank()) {
            return "no details";
        }
        String line = text.strip().lines().findFirst().orElse("").strip();
        return line.length() > MAX_CAUSE_LENGTH ? line.substring(0, MAX_CAUSE_LENGTH) + "..." : line;
    }
}
