package fr.lapetina.airouter.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a provider's health.
 * Adapters return raw observations; the health monitor stores the derived status.
 *
 * @param lastCheckedAt       null until the first probe
 * @param lastResponseTimeMs  probe round trip, -1 when unknown
 * @param consecutiveFailures failed probes since the last success
 */
public record ProviderHealth(
        String providerId,
        HealthStatus status,
        Instant lastCheckedAt,
        long lastResponseTimeMs,
        String detail,
        int consecutiveFailures
) {
    public ProviderHealth {
        Objects.requireNonNull(providerId, "Provider id is required");
        Objects.requireNonNull(status, "Status is required");
    }

    /**
     * Initial entry for a newly registered provider.
     */
    public static ProviderHealth initial(String providerId) {
        return new ProviderHealth(providerId, HealthStatus.HEALTHY, null, -1, "not yet probed", 0);
    }

    public static ProviderHealth healthy(String providerId, long responseTimeMs) {
        return new ProviderHealth(providerId, HealthStatus.HEALTHY, Instant.now(), responseTimeMs, "ok", 0);
    }

    public static ProviderHealth degraded(String providerId, long responseTimeMs, String detail) {
        return new ProviderHealth(providerId, HealthStatus.DEGRADED, Instant.now(), responseTimeMs, detail, 0);
    }

    public static ProviderHealth unhealthy(String providerId, String detail) {
        return new ProviderHealth(providerId, HealthStatus.UNHEALTHY, Instant.now(), -1, detail, 0);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    public ProviderHealth withStatus(HealthStatus newStatus, int failures) {
        return new ProviderHealth(providerId, newStatus, lastCheckedAt, lastResponseTimeMs, detail, failures);
    }
}
