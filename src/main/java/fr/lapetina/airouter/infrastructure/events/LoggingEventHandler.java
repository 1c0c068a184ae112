package fr.lapetina.airouter.infrastructure.events;

import com.lmax.disruptor.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes one audit line per finished request to the {@code fr.lapetina.airouter.audit} logger.
 * Intermediate events go out at debug level.
 */
public final class LoggingEventHandler implements EventHandler<RoutingEvent> {

    static final String AUDIT_LOGGER = "fr.lapetina.airouter.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        MDC.put("requestId", event.getRequestId());
        if (event.getModel() != null) {
            MDC.put("model", event.getModel());
        }
        try {
            log(event);
        } finally {
            MDC.remove("requestId");
            MDC.remove("model");
        }
    }

    private void log(RoutingEvent event) {
        switch (event.getType()) {
            case REQUEST_STARTED -> audit.debug("Request started: requestId={}, model={}, streaming={}",
                    event.getRequestId(), event.getModel(), event.isStreaming());
            case ATTEMPT_FINISHED -> audit.debug("Attempt finished: requestId={}, providerId={}, outcome={}, kind={}, durationMs={}",
                    event.getRequestId(), event.getProviderId(), event.getOutcome(), event.getErrorKind(),
                    event.getDurationMs());
            case FAILOVER -> audit.debug("Failover: requestId={}, from={}, to={}, cause={}",
                    event.getRequestId(), event.getFromProvider(), event.getProviderId(), event.getErrorKind());
            case REQUEST_SUCCEEDED -> audit.info(
                    "Request succeeded: requestId={}, providerId={}, model={}, attempts={}, promptTokens={}, completionTokens={}, cost={}, elapsedMs={}",
                    event.getRequestId(), event.getProviderId(), event.getModel(), event.getAttempts(),
                    event.getPromptTokens(), event.getCompletionTokens(),
                    event.getCost() != null ? event.getCost().toPlainString() : "unavailable",
                    event.getDurationMs());
            case REQUEST_FAILED -> audit.info(
                    "Request failed: requestId={}, model={}, kind={}, lastErrorKind={}, attempts={}, deadlineExceeded={}, elapsedMs={}",
                    event.getRequestId(), event.getModel(), event.getFailureKind(), event.getErrorKind(),
                    event.getAttempts(), event.isDeadlineExceeded(), event.getDurationMs());
        }
    }
}
