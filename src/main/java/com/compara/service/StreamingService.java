package com.compara.service;

import com.compara.model.ChunkEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;

/**
 * Service for encoding comparison events as Server-Sent Events.
 * Each event is written as a single {@code data: <json>} frame.
 */
@Slf4j
@Service
public class StreamingService {

    private final ObjectMapper objectMapper;

    public StreamingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encode events as raw SSE frames. Written as bytes so the framework does not wrap them a second time.
     */
    public Flux<DataBuffer> toServerSentEvents(Flux<ChunkEvent> events) {
        return events.map(event -> {
            byte[] bytes = formatAsSSE(event).getBytes(StandardCharsets.UTF_8);
            return (DataBuffer) DefaultDataBufferFactory.sharedInstance.wrap(bytes);
        });
    }

    /**
     * Format event as SSE (Server-Sent Events) message.
     */
    public String formatAsSSE(ChunkEvent event) {
        return "data: " + serializeToJson(event) + "\n\n";
    }

    private String serializeToJson(ChunkEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("JSON serialization error for {} event", event.getType(), e);
            return "{\"type\":\"error\",\"message\":\"serialization_error\"}";
        }
    }
}
