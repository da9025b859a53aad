package com.compara.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event of the multiplexed comparison stream.
 * Every event except {@code complete} and {@code error} is tagged with its model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "model", "content", "error", "message", "metadata"})
public class ChunkEvent {

    @JsonProperty("type")
    private ChunkEventType type;

    @JsonProperty("model")
    private String model;

    @JsonProperty("content")
    private String content;

    /**
     * Present on {@code done} events only.
     */
    @JsonProperty("error")
    private Boolean error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("metadata")
    private CompletionMetadata metadata;

    public static ChunkEvent start(String model) {
        return ChunkEvent.builder().type(ChunkEventType.START).model(model).build();
    }

    public static ChunkEvent chunk(String model, String content) {
        return ChunkEvent.builder().type(ChunkEventType.CHUNK).model(model).content(content).build();
    }

    public static ChunkEvent keepalive(String model) {
        return ChunkEvent.builder().type(ChunkEventType.KEEPALIVE).model(model).build();
    }

    public static ChunkEvent done(String model, boolean error) {
        return ChunkEvent.builder().type(ChunkEventType.DONE).model(model).error(error).build();
    }

    public static ChunkEvent complete(CompletionMetadata metadata) {
        return ChunkEvent.builder().type(ChunkEventType.COMPLETE).metadata(metadata).build();
    }

    public static ChunkEvent error(String message) {
        return ChunkEvent.builder().type(ChunkEventType.ERROR).message(message).build();
    }
}
