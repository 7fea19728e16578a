package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.TaskPhase;
import com.autonomous.dogwalker.model.TaskSummary;

/**
 * Prompts for each phase the coding agent takes part in.
 */
public final class PromptBuilder {

    private PromptBuilder() {}

    public static String forPhase(TaskPhase phase, String description, TaskSummary summary, String feedback) {
        String prompt = switch (phase) {
            case PLANNING -> plan(description);
            case IMPLEMENTING -> implement(description, summary);
            case SELF_REVIEW -> review(description, summary);
            case TESTING -> test(description, summary);
            default -> throw new IllegalArgumentException("The coding agent takes no part in " + phase);
        };
        return feedback == null || feedback.isBlank() ? prompt : prompt + "\n" + feedback;
    }

    public static String withAnswer(String prompt, String question, String answer) {
        return prompt + "\n\nYou asked: " + question + "\nThe human answered: " + answer + "\n";
    }

    public static String withoutAnswer(String prompt, String question) {
        return prompt + "\n\nYou asked: " + question
            + "\nNobody answered in time. Use your best judgment and note the assumption you made.\n";
    }

    private static String plan(String description) {
        return """
            You are planning a code change. Do not modify any files yet.

            Request:
            %s

            Write a short implementation plan as a markdown bullet list: which files you expect
            to touch and what changes each needs. Start your answer with a single line
            "TITLE: <concise pull request title>". If the request is too ambiguous to plan,
            add one line "QUESTION: <your question>".
            """.formatted(description);
    }

    private static String implement(String description, TaskSummary summary) {
        return """
            Implement the following request in this repository.

            Request:
            %s

            Plan:
            %s

            Make the code changes now. Keep them focused on the request.
            If you are blocked on a decision only the requester can make, add one line
            "QUESTION: <your question>".
            """.formatted(description, orNone(summary.getPlan()));
    }

    private static String review(String description, TaskSummary summary) {
        return """
            Critically review the changes you just made for this request:
            %s

            Files changed: %s

            Fix bugs, missing edge cases, unclear names and security problems directly in the code.
            Then list, as markdown bullets, only the areas a human reviewer must look at closely.
            Answer "None" if there are none.
            """.formatted(description, String.join(", ", summary.getFilesTouched()));
    }

    private static String test(String description, TaskSummary summary) {
        return """
            Write tests covering the changes for this request and run the project's test suite:
            %s

            Files changed: %s

            Fix failures caused by the change. End your answer with exactly one line:
            "TESTS: PASSED" or "TESTS: FAILED".
            """.formatted(description, String.join(", ", summary.getFilesTouched()));
    }

    private static String orNone(String text) {
        return text == null || text.isBlank() ? "(none)" : text;
    }
}
