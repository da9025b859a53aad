package com.compara.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminator of the events written to the comparison stream.
 */
public enum ChunkEventType {
    START,
    CHUNK,
    KEEPALIVE,
    DONE,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
