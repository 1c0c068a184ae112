package fr.lapetina.airouter.domain.exception;

import fr.lapetina.airouter.domain.model.ErrorKind;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Terminal failure of a routing pass.
 * Carries the ordered (provider, error kind) pairs of every attempt made.
 */
public class RoutingException extends RuntimeException {

    private final Kind kind;
    private final String requestId;
    private final List<AttemptFailure> failures;
    private final boolean deadlineExceeded;

    public RoutingException(Kind kind, String requestId, String message, List<AttemptFailure> failures,
                            boolean deadlineExceeded) {
        super(message + describe(failures));
        this.kind = Objects.requireNonNull(kind, "Kind is required");
        this.requestId = requestId;
        this.failures = failures != null ? List.copyOf(failures) : List.of();
        this.deadlineExceeded = deadlineExceeded;
    }

    public static RoutingException invalidRequest(String requestId, String reason) {
        return new RoutingException(Kind.INVALID_REQUEST, requestId, reason, List.of(), false);
    }

    public static RoutingException budgetExceeded(String requestId, String reason) {
        return new RoutingException(Kind.BUDGET_EXCEEDED, requestId, reason, List.of(), false);
    }

    public Kind getKind() {
        return kind;
    }

    public String getRequestId() {
        return requestId;
    }

    public List<AttemptFailure> getFailures() {
        return failures;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }

    /**
     * Classification of the last attempt, if any attempt was made.
     */
    public Optional<ErrorKind> lastErrorKind() {
        return failures.isEmpty()
                ? Optional.empty()
                : Optional.of(failures.get(failures.size() - 1).errorKind());
    }

    private static String describe(List<AttemptFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            return "";
        }
        return failures.stream()
                .map(f -> f.providerId() + "=" + f.errorKind().wireName())
                .collect(Collectors.joining(", ", " [", "]"));
    }

    public enum Kind {
        /** Every candidate was tried, or the deadline expired first */
        ALL_PROVIDERS_FAILED,

        /** Worst-case cost of the request exceeds the configured ceiling */
        BUDGET_EXCEEDED,

        /** Request rejected before or by the first provider as malformed or unauthorized */
        INVALID_REQUEST
    }

    /**
     * One failed attempt as reported to callers.
     */
    public record AttemptFailure(String providerId, ErrorKind errorKind) {
        public AttemptFailure {
            Objects.requireNonNull(providerId, "Provider id is required");
            Objects.requireNonNull(errorKind, "Error kind is required");
        }
    }
}
