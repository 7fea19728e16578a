package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.AgentResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    @Test
    void shouldExtractMarkers() {
        AgentResponse response = ResponseParser.parse("""
            TITLE: Add rate limiting to login
            - add a limiter
            QUESTION: Per IP or per account?
            TESTS: passed
            """);

        assertEquals("Add rate limiting to login", response.getTitle());
        assertEquals("Per IP or per account?", response.getQuestion());
        assertTrue(response.hasQuestion());
        assertEquals(Boolean.TRUE, response.getTestsPassed());
    }

    @Test
    void shouldLeaveMissingMarkersEmpty() {
        AgentResponse response = ResponseParser.parse("Just some text");

        assertNull(response.getTitle());
        assertFalse(response.hasQuestion());
        assertNull(response.getTestsPassed());
    }

    @Test
    void shouldReadFailedTests() {
        assertEquals(Boolean.FALSE, ResponseParser.parse("1 failure\nTESTS: FAILED").getTestsPassed());
    }

    @Test
    void shouldShortenLongTitles() {
        String title = ResponseParser.parse("TITLE: " + "x".repeat(80)).getTitle();

        assertEquals(63, title.length());
        assertTrue(title.endsWith("..."));
    }

    @Test
    void shouldStripTitleAndQuestionLines() {
        assertEquals("- add a limiter", ResponseParser.stripMarkers("TITLE: Rate limit\n- add a limiter\nQUESTION: ok?"));
    }
}
