package fr.lapetina.airouter.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Routing facts attached to a completed response.
 *
 * @param requestId          caller's request id
 * @param callId             id of the outbound provider call that produced the response
 * @param attemptedProviders providers tried, in order, ending with the one that answered
 * @param costAvailable      false when no price was configured for the provider/model pair
 */
public record ResponseMetadata(
        String requestId,
        String callId,
        Instant timestamp,
        boolean streaming,
        boolean fallbackUsed,
        List<String> attemptedProviders,
        boolean costAvailable
) {
    public ResponseMetadata {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        attemptedProviders = attemptedProviders != null ? List.copyOf(attemptedProviders) : List.of();
    }

    /**
     * Metadata as an adapter reports it for a single call, before routing facts are known.
     */
    public static ResponseMetadata forCall(String requestId, String callId, String providerId, boolean streaming) {
        return new ResponseMetadata(requestId, callId, Instant.now(), streaming, false,
                List.of(providerId), false);
    }

    public ResponseMetadata withRouting(List<String> attempted, boolean costKnown) {
        return new ResponseMetadata(requestId, callId, timestamp, streaming,
                attempted.size() > 1, attempted, costKnown);
    }
}
