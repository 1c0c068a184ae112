package fr.lapetina.airouter.domain.exception;

/**
 * Failure while consuming a completion stream.
 */
public class StreamException extends RuntimeException {

    private final Kind kind;
    private final String providerId;

    public StreamException(Kind kind, String providerId, String message) {
        super(message);
        this.kind = kind;
        this.providerId = providerId;
    }

    public StreamException(Kind kind, String providerId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.providerId = providerId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getProviderId() {
        return providerId;
    }

    public enum Kind {
        /** Stream stopped early; the summary is flagged failed */
        PARTIAL,

        /** Stream broke after content reached the caller; no failover possible */
        TERMINAL
    }
}
