package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;

import java.math.BigDecimal;

/**
 * Observability hook the router reports to.
 *
 * Called on routing threads, so implementations must return quickly and must not throw.
 * Every method defaults to a no-op.
 */
public interface RoutingEventSink {

    RoutingEventSink NOOP = new RoutingEventSink() {
    };

    default void requestStarted(String requestId, String model, boolean streaming) {
    }

    default void attemptFinished(String requestId, String model, RoutingAttempt attempt) {
    }

    default void failover(String requestId, String fromProvider, String toProvider, ErrorKind cause) {
    }

    /**
     * @param cost null when the provider/model pair is not priced
     */
    default void requestSucceeded(String requestId, String providerId, String model, Usage usage,
                                  BigDecimal cost, int attempts, long elapsedMs) {
    }

    default void requestFailed(String requestId, String model, RoutingException error, long elapsedMs) {
    }
}
