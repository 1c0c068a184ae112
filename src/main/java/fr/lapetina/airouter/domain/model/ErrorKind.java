package fr.lapetina.airouter.domain.model;

import java.util.Locale;

/**
 * Canonical classification of a provider failure.
 * Drives the failover decision and the error counters.
 */
public enum ErrorKind {
    /** Credential rejected (401) */
    AUTH(false),

    /** Vendor throttled the call (429) or the local concurrency limit was hit */
    RATE_LIMITED(true),

    /** Vendor-side failure (5xx) or broken connection */
    UPSTREAM_5XX(true),

    /** No answer within the attempt budget */
    TIMEOUT(true),

    /** Request rejected as malformed (other 4xx) */
    BAD_REQUEST(false),

    /** Anything else, including undecodable bodies */
    UNKNOWN(true);

    private final boolean failoverEligible;

    ErrorKind(boolean failoverEligible) {
        this.failoverEligible = failoverEligible;
    }

    /**
     * Whether the router should move on to the next candidate after this error.
     * Request-shape problems would fail identically everywhere, so they stop routing.
     */
    public boolean isFailoverEligible() {
        return failoverEligible;
    }

    /**
     * Maps a non-2xx HTTP status to its kind.
     */
    public static ErrorKind fromStatus(int statusCode) {
        if (statusCode == 401) {
            return AUTH;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500 && statusCode < 600) {
            return UPSTREAM_5XX;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return BAD_REQUEST;
        }
        return UNKNOWN;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
