package fr.lapetina.airouter.domain.exception;

import fr.lapetina.airouter.domain.model.ErrorKind;

import java.util.Objects;

/**
 * Failure of a single outbound provider call, already classified.
 * Never carries the raw vendor body in its message beyond a short excerpt.
 */
public class ProviderException extends RuntimeException {

    private static final int MAX_DETAIL_LENGTH = 200;

    private final ErrorKind kind;
    private final int statusCode;
    private final String providerId;
    private final String requestId;

    /**
     * @param statusCode HTTP status, 0 when no response was received
     * @param requestId  call id of the failed outbound call
     */
    public ProviderException(ErrorKind kind, int statusCode, String providerId, String requestId, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.statusCode = statusCode;
        this.providerId = providerId;
        this.requestId = requestId;
    }

    public ProviderException(ErrorKind kind, int statusCode, String providerId, String requestId,
                             String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.statusCode = statusCode;
        this.providerId = providerId;
        this.requestId = requestId;
    }

    /**
     * Builds an exception from a non-2xx vendor response.
     */
    public static ProviderException fromStatus(int statusCode, String providerId, String requestId, String body) {
        ErrorKind kind = ErrorKind.fromStatus(statusCode);
        return new ProviderException(kind, statusCode, providerId, requestId,
                "HTTP " + statusCode + " from " + providerId + ": " + excerpt(body));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getRequestId() {
        return requestId;
    }

    private static String excerpt(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= MAX_DETAIL_LENGTH ? flat : flat.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
