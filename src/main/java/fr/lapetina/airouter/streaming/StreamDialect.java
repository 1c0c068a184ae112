package fr.lapetina.airouter.streaming;

import java.io.IOException;
import java.util.Optional;

/**
 * A vendor's stream framing and payload rules.
 *
 * <p>Framing is line-delimited. {@link #payload(String)} selects the lines that carry data,
 * {@link #isSentinel(String)} recognizes an explicit end marker, and {@link #decode(String)}
 * turns one payload into a {@link StreamDelta}.
 */
public interface StreamDialect {

    /** Prefix used by server-sent events data lines. */
    String SSE_DATA_PREFIX = "data:";

    /**
     * Extracts the payload of a line, or empty when the line carries no data.
     */
    Optional<String> payload(String line);

    /**
     * Whether the payload is a terminal sentinel rather than JSON.
     */
    default boolean isSentinel(String payload) {
        return false;
    }

    /**
     * Decodes one payload.
     *
     * @throws IOException if the payload is malformed; the normalizer skips it
     */
    StreamDelta decode(String payload) throws IOException;

    /**
     * Payload extraction for server-sent events: only {@code data:} lines, prefix stripped.
     */
    static Optional<String> ssePayload(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return Optional.empty();
        }
        String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
        return payload.isEmpty() ? Optional.empty() : Optional.of(payload);
    }

    /**
     * Payload extraction for newline-delimited JSON: every non-blank line.
     */
    static Optional<String> ndjsonPayload(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(line.trim());
    }
}
