package fr.lapetina.airouter.domain.model;

/**
 * Health status of an upstream provider.
 *
 * HEALTHY: last probe succeeded
 * DEGRADED: recent failures, below the unhealthy threshold
 * UNHEALTHY: consecutive failures reached the threshold; tried last
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /**
     * Numeric value for gauges (2 healthy, 1 degraded, 0 unhealthy).
     */
    public int gaugeValue() {
        return switch (this) {
            case HEALTHY -> 2;
            case DEGRADED -> 1;
            case UNHEALTHY -> 0;
        };
    }
}
