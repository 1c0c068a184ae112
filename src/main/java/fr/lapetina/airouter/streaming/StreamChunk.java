package fr.lapetina.airouter.streaming;

import java.util.Objects;

/**
 * One incremental text delta.
 */
public record StreamChunk(String text) {
    public StreamChunk {
        Objects.requireNonNull(text, "Text is required");
    }
}
