package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.AgentResponse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured markers out of the coding agent's free-text answer.
 *
 * <pre>
 *   TITLE: Add rate limiting to login
 *   QUESTION: Should the limit be per IP or per account?
 *   TESTS: PASSED
 * </pre>
 */
public final class ResponseParser {

    private static final Pattern TITLE = Pattern.compile("^\\s*TITLE:\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern QUESTION = Pattern.compile("^\\s*QUESTION:\\s*(.+)$", Pattern.MULTILINE);
    private static final Pattern TESTS = Pattern.compile("^\\s*TESTS:\\s*(PASSED|FAILED)\\b",
        Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private static final int MAX_TITLE_LENGTH = 60;

    private ResponseParser() {}

    public static AgentResponse parse(String output) {
        String text = output == null ? "" : output.strip();
        return AgentResponse.builder()
            .output(text)
            .title(extractTitle(text).orElse(null))
            .question(extractQuestion(text).orElse(null))
            .testsPassed(extractTestsPassed(text).orElse(null))
            .build();
    }

    public static Optional<String> extractTitle(String output) {
        return first(TITLE, output).map(ResponseParser::shorten);
    }

    public static Optional<String> extractQuestion(String output) {
        return first(QUESTION, output);
    }

    public static Optional<Boolean> extractTestsPassed(String output) {
        return first(TESTS, output).map(verdict -> verdict.equalsIgnoreCase("PASSED"));
    }

    /**
     * The answer without its marker lines.
     */
    public static String stripMarkers(String output) {
        if (output == null) {
            return "";
        }
        String stripped = TITLE.matcher(output).replaceAll("");
        stripped = QUESTION.matcher(stripped).replaceAll("");
        return stripped.strip();
    }

    public static String shorten(String text) {
        String single = text.strip().replaceAll("\\s+", " ");
        return single.length() > MAX_TITLE_LENGTH ? single.substring(0, MAX_TITLE_LENGTH) + "..." : single;
    }

    private static Optional<String> first(Pattern pattern, String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher m = pattern.matcher(output);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
