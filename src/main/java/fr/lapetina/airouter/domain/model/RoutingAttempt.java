package fr.lapetina.airouter.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one dispatch to one candidate within a routing pass.
 *
 * @param errorKind null on success
 */
public record RoutingAttempt(
        String providerId,
        Instant startedAt,
        Outcome outcome,
        ErrorKind errorKind,
        long durationMs
) {
    public RoutingAttempt {
        Objects.requireNonNull(providerId, "Provider id is required");
        Objects.requireNonNull(outcome, "Outcome is required");
    }

    public static RoutingAttempt success(String providerId, Instant startedAt, long durationMs) {
        return new RoutingAttempt(providerId, startedAt, Outcome.SUCCESS, null, durationMs);
    }

    public static RoutingAttempt failure(String providerId, Instant startedAt, ErrorKind kind, long durationMs) {
        Outcome outcome = kind == ErrorKind.TIMEOUT ? Outcome.TIMEOUT : Outcome.ERROR;
        return new RoutingAttempt(providerId, startedAt, outcome, kind, durationMs);
    }

    public enum Outcome {
        SUCCESS,
        TIMEOUT,
        ERROR
    }
}
