package com.compara.stream;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ErrorContentDetector.
 */
class ErrorContentDetectorTest {

    @Test
    void testBackendErrorsDetected() {
        assertTrue(ErrorContentDetector.isErrorContent("Error: Timeout (55s)"));
        assertTrue(ErrorContentDetector.isErrorContent("Error: Rate limited"));
        assertTrue(ErrorContentDetector.isErrorContent("Error: Model not available - gone"));
        assertTrue(ErrorContentDetector.isErrorContent("Error: Authentication failed"));
        assertTrue(ErrorContentDetector.isErrorContent("  Error: 502 Bad Gateway  "));
    }

    @Test
    void testShortErrorLineDetected() {
        assertTrue(ErrorContentDetector.isErrorContent("Error: upstream exploded"));
    }

    @Test
    void testAnswerStartingWithErrorSentenceIsNotError() {
        assertFalse(ErrorContentDetector.isErrorContent("Error: this is how the word is used in a sentence."));
    }

    @Test
    void testOrdinaryAnswer() {
        assertFalse(ErrorContentDetector.isErrorContent("The capital of France is Paris."));
        assertFalse(ErrorContentDetector.isErrorContent(null));
    }

    @Test
    void testErrorAppendedToLongAnswer() {
        String answer = "Paris is the capital of France. ".repeat(10) + "\nError: Rate limit exceeded";

        assertTrue(ErrorContentDetector.isErrorContent(answer));
    }

    @Test
    void testErrorMentionedEarlyInLongAnswerIgnored() {
        String answer = "A log line such as Error: Timeout (5s) means the call hung. "
                + "Retrying with backoff usually helps. ".repeat(10);

        assertFalse(ErrorContentDetector.isErrorContent(answer));
    }
}
