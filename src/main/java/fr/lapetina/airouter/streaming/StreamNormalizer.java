package fr.lapetina.airouter.streaming;

import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.domain.model.ResponseMetadata;
import fr.lapetina.airouter.domain.model.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a raw vendor byte stream into canonical text chunks and a final summary.
 *
 * <p>Reading is lazy: nothing is read until the consumer pulls. Lines the dialect does not
 * recognize are ignored, malformed payloads are skipped, and the sentinel ends consumption
 * early. Token counts keep the latest value reported for prompt and completion separately.
 * A read error ends the stream with a summary flagged failed; chunks already returned stay
 * valid.
 */
public final class StreamNormalizer implements CompletionStream {

    private static final Logger log = LoggerFactory.getLogger(StreamNormalizer.class);

    private final InputStream source;
    private final BufferedReader reader;
    private final StreamDialect dialect;
    private final String providerId;
    private final String requestId;
    private final String callId;

    private StreamChunk pending;
    private boolean finished;
    private boolean delivered;
    private volatile boolean closed;
    private StreamSummary summary;

    private Integer promptTokens;
    private Integer completionTokens;
    private FinishReason finishReason;
    private String model;
    private int malformedPayloads;

    /**
     * @param requestedModel model reported in the summary when the vendor never names one
     */
    public StreamNormalizer(
            InputStream source,
            StreamDialect dialect,
            String providerId,
            String requestId,
            String callId,
            String requestedModel
    ) {
        this.source = Objects.requireNonNull(source, "Source is required");
        this.dialect = Objects.requireNonNull(dialect, "Dialect is required");
        this.reader = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
        this.providerId = providerId;
        this.requestId = requestId;
        this.callId = callId;
        this.model = requestedModel;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        while (!finished) {
            if (closed) {
                finish(true, "stream closed before completion");
                return false;
            }
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                if (closed) {
                    finish(true, "stream closed before completion");
                } else {
                    log.warn("Stream read failed: providerId={}, callId={}, error={}",
                            providerId, callId, e.getMessage());
                    finish(true, "stream read failed: " + e.getMessage());
                }
                return false;
            }
            if (line == null) {
                finish(false, null);
                return false;
            }
            if (consume(line)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream exhausted");
        }
        StreamChunk chunk = pending;
        pending = null;
        return chunk;
    }

    /**
     * Handles one line; returns true when it produced a chunk for the consumer.
     */
    private boolean consume(String line) {
        Optional<String> payload = dialect.payload(line);
        if (payload.isEmpty()) {
            return false;
        }
        String data = payload.get();
        if (dialect.isSentinel(data)) {
            log.debug("Stream sentinel received: providerId={}, callId={}", providerId, callId);
            finish(false, null);
            return false;
        }

        StreamDelta delta;
        try {
            delta = dialect.decode(data);
        } catch (IOException | RuntimeException e) {
            malformedPayloads++;
            log.debug("Skipping malformed stream payload: providerId={}, callId={}, error={}",
                    providerId, callId, e.getMessage());
            return false;
        }

        if (delta.promptTokens() != null) {
            promptTokens = delta.promptTokens();
        }
        if (delta.completionTokens() != null) {
            completionTokens = delta.completionTokens();
        }
        if (delta.finishReason() != null) {
            finishReason = delta.finishReason();
        }
        if (delta.model() != null && !delta.model().isBlank()) {
            model = delta.model();
        }

        boolean produced = false;
        if (delta.hasText()) {
            pending = new StreamChunk(delta.text());
            delivered = true;
            produced = true;
        }
        if (delta.error() != null) {
            log.warn("Vendor reported stream error: providerId={}, callId={}, error={}",
                    providerId, callId, delta.error());
            finish(true, "vendor error: " + delta.error());
        } else if (delta.terminal()) {
            finish(false, null);
        }
        return produced;
    }

    private void finish(boolean failed, String detail) {
        if (finished) {
            return;
        }
        finished = true;
        summary = new StreamSummary(
                providerId,
                model,
                Usage.ofNullable(promptTokens, completionTokens),
                failed ? FinishReason.ERROR : finishReason,
                failed,
                detail,
                null,
                ResponseMetadata.forCall(requestId, callId, providerId, true)
        );
        log.debug("Stream finished: providerId={}, callId={}, failed={}, promptTokens={}, completionTokens={}, malformed={}",
                providerId, callId, failed, summary.usage().promptTokens(), summary.usage().completionTokens(),
                malformedPayloads);
        closeSource();
    }

    @Override
    public StreamSummary summary() {
        if (!finished) {
            throw new IllegalStateException("Stream not yet consumed: callId=" + callId);
        }
        return summary;
    }

    @Override
    public boolean hasDeliveredContent() {
        return delivered;
    }

    /**
     * Number of payloads skipped because they could not be decoded.
     */
    public int getMalformedPayloads() {
        return malformedPayloads;
    }

    /**
     * Aborts the read. A blocked {@link #hasNext()} on another thread returns false.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            closeSource();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void closeSource() {
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Error closing stream source: providerId={}, callId={}", providerId, callId, e);
        }
    }
}
