package fr.lapetina.airouter.infrastructure.events;

import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * This is a mutable holder that gets reused across the ring buffer. Publishers fill it
 * through one of the {@code as*} initializers; handlers only read it.
 */
public final class RoutingEvent {

    /**
     * What happened.
     */
    public enum Type {
        REQUEST_STARTED,
        ATTEMPT_FINISHED,
        FAILOVER,
        REQUEST_SUCCEEDED,
        REQUEST_FAILED
    }

    private Type type;
    private String requestId;
    private String model;
    private String providerId;
    private String fromProvider;
    private boolean streaming;

    // Attempt data
    private RoutingAttempt.Outcome outcome;
    private ErrorKind errorKind;
    private long durationMs;

    // Completion data
    private int promptTokens;
    private int completionTokens;
    private BigDecimal cost;
    private int attempts;

    // Failure data
    private RoutingException.Kind failureKind;
    private boolean deadlineExceeded;
    private String failureMessage;

    private Instant publishedAt;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.requestId = null;
        this.model = null;
        this.providerId = null;
        this.fromProvider = null;
        this.streaming = false;
        this.outcome = null;
        this.errorKind = null;
        this.durationMs = 0;
        this.promptTokens = 0;
        this.completionTokens = 0;
        this.cost = null;
        this.attempts = 0;
        this.failureKind = null;
        this.deadlineExceeded = false;
        this.failureMessage = null;
        this.publishedAt = null;
    }

    void asRequestStarted(String requestId, String model, boolean streaming) {
        begin(Type.REQUEST_STARTED, requestId, model);
        this.streaming = streaming;
    }

    void asAttemptFinished(String requestId, String model, RoutingAttempt attempt) {
        begin(Type.ATTEMPT_FINISHED, requestId, model);
        this.providerId = attempt.providerId();
        this.outcome = attempt.outcome();
        this.errorKind = attempt.errorKind();
        this.durationMs = attempt.durationMs();
    }

    void asFailover(String requestId, String fromProvider, String toProvider, ErrorKind cause) {
        begin(Type.FAILOVER, requestId, null);
        this.fromProvider = fromProvider;
        this.providerId = toProvider;
        this.errorKind = cause;
    }

    void asRequestSucceeded(String requestId, String providerId, String model, Usage usage,
                            BigDecimal cost, int attempts, long elapsedMs) {
        begin(Type.REQUEST_SUCCEEDED, requestId, model);
        this.providerId = providerId;
        this.promptTokens = usage.promptTokens();
        this.completionTokens = usage.completionTokens();
        this.cost = cost;
        this.attempts = attempts;
        this.durationMs = elapsedMs;
    }

    void asRequestFailed(String requestId, String model, RoutingException error, long elapsedMs) {
        begin(Type.REQUEST_FAILED, requestId, model);
        this.failureKind = error.getKind();
        this.deadlineExceeded = error.isDeadlineExceeded();
        this.failureMessage = error.getMessage();
        this.errorKind = error.lastErrorKind().orElse(null);
        this.attempts = error.getFailures().size();
        this.durationMs = elapsedMs;
    }

    private void begin(Type type, String requestId, String model) {
        clear();
        this.type = type;
        this.requestId = requestId;
        this.model = model;
        this.publishedAt = Instant.now();
    }

    public Type getType() {
        return type;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getModel() {
        return model;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getFromProvider() {
        return fromProvider;
    }

    public boolean isStreaming() {
        return streaming;
    }

    public RoutingAttempt.Outcome getOutcome() {
        return outcome;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getPromptTokens() {
        return promptTokens;
    }

    public int getCompletionTokens() {
        return completionTokens;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public int getAttempts() {
        return attempts;
    }

    public RoutingException.Kind getFailureKind() {
        return failureKind;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    @Override
    public String toString() {
        return "RoutingEvent{" +
                "type=" + type +
                ", requestId=" + requestId +
                ", provider=" + providerId +
                ", model=" + model +
                '}';
    }
}
