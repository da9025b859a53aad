package com.compara.service;

import com.compara.model.ChunkEvent;
import com.compara.model.CompletionMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamingService.
 */
class StreamingServiceTest {

    private StreamingService streamingService;

    @BeforeEach
    void setUp() {
        streamingService = new StreamingService(new ObjectMapper());
    }

    @Test
    void testStartEvent() {
        assertEquals("data: {\"type\":\"start\",\"model\":\"m/a\"}\n\n",
                streamingService.formatAsSSE(ChunkEvent.start("m/a")));
    }

    @Test
    void testChunkEvent() {
        assertEquals("data: {\"type\":\"chunk\",\"model\":\"m/a\",\"content\":\"Hi \\\"there\\\"\"}\n\n",
                streamingService.formatAsSSE(ChunkEvent.chunk("m/a", "Hi \"there\"")));
    }

    @Test
    void testDoneEventCarriesErrorFlag() {
        assertEquals("data: {\"type\":\"done\",\"model\":\"m/b\",\"error\":true}\n\n",
                streamingService.formatAsSSE(ChunkEvent.done("m/b", true)));
    }

    @Test
    void testCompleteEventHasNoModel() {
        String frame = streamingService.formatAsSSE(ChunkEvent.complete(CompletionMetadata.builder()
                .modelsRequested(2)
                .modelsSuccessful(1)
                .modelsFailed(1)
                .creditsUsed(1)
                .creditsRemaining(99)
                .build()));

        assertTrue(frame.startsWith("data: {\"type\":\"complete\",\"metadata\":{"), frame);
        assertTrue(frame.contains("\"credits_used\":1.0"), frame);
        assertTrue(frame.contains("\"credits_remaining\":99"), frame);
        assertFalse(frame.contains("\"model\""), frame);
    }

    @Test
    void testFramesWrittenAsBytes() {
        Flux<String> frames = streamingService
                .toServerSentEvents(Flux.just(ChunkEvent.start("m/a"), ChunkEvent.keepalive("m/a")))
                .map(StreamingServiceTest::asString);

        StepVerifier.create(frames)
                .expectNext("data: {\"type\":\"start\",\"model\":\"m/a\"}\n\n")
                .expectNext("data: {\"type\":\"keepalive\",\"model\":\"m/a\"}\n\n")
                .verifyComplete();
    }

    private static String asString(DataBuffer buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
