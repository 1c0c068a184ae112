package fr.lapetina.airouter.infrastructure.events;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.metrics.MetricsRegistry;

import java.time.Duration;

/**
 * Turns routing events into Micrometer measurements.
 */
public final class MetricsEventHandler implements EventHandler<RoutingEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsEventHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
        switch (event.getType()) {
            case ATTEMPT_FINISHED -> metricsRegistry.recordAttempt(
                    event.getProviderId(), event.getOutcome(), event.getErrorKind(),
                    Duration.ofMillis(event.getDurationMs()));
            case FAILOVER -> metricsRegistry.incrementFailover(event.getFromProvider(), event.getProviderId());
            case REQUEST_SUCCEEDED -> {
                metricsRegistry.recordRequest(event.getModel(), "success", Duration.ofMillis(event.getDurationMs()));
                metricsRegistry.recordTokens(event.getProviderId(), event.getModel(),
                        Usage.of(event.getPromptTokens(), event.getCompletionTokens()));
                if (event.getCost() != null) {
                    metricsRegistry.recordCost(event.getProviderId(), event.getModel(), event.getCost());
                }
            }
            case REQUEST_FAILED -> metricsRegistry.recordRequest(
                    event.getModel() != null ? event.getModel() : "unknown",
                    event.getFailureKind().name().toLowerCase(),
                    Duration.ofMillis(event.getDurationMs()));
            case REQUEST_STARTED -> {
                // counted on completion
            }
        }
    }
}
