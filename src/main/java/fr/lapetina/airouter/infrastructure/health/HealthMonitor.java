package fr.lapetina.airouter.infrastructure.health;

import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.HealthStatus;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Probes providers and maintains their health status.
 *
 * Probes run in the background at a fixed interval and on demand after a failed live call.
 * At most one probe per provider is in flight; concurrent triggers share its result.
 *
 * Transitions: any successful probe resets to HEALTHY. A failed probe increments the
 * consecutive failure count and yields DEGRADED, or UNHEALTHY once the count reaches
 * the threshold.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, ProviderAdapter> adapters;
    private final ProviderHealthTable healthTable;
    private final Duration probeTimeout;
    private final int unhealthyThreshold;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(
            Map<String, ProviderAdapter> adapters,
            ProviderHealthTable healthTable,
            Duration probeTimeout,
            int unhealthyThreshold
    ) {
        if (unhealthyThreshold < 1) {
            throw new IllegalArgumentException("unhealthyThreshold must be at least 1");
        }
        this.adapters = Map.copyOf(adapters);
        this.healthTable = healthTable;
        this.probeTimeout = probeTimeout;
        this.unhealthyThreshold = unhealthyThreshold;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "health-checker-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.adapters.keySet().forEach(healthTable::register);
    }

    public HealthMonitor(Map<String, ProviderAdapter> adapters, ProviderHealthTable healthTable) {
        this(adapters, healthTable, Duration.ofSeconds(5), 3);
    }

    /**
     * Starts periodic probing of every provider.
     */
    public void startBackgroundProbing(Duration interval) {
        if (running.compareAndSet(false, true)) {
            for (String providerId : adapters.keySet()) {
                scheduler.scheduleWithFixedDelay(
                        () -> probeAsync(providerId),
                        0,
                        interval.toMillis(),
                        TimeUnit.MILLISECONDS
                );
            }
            log.info("Background probing started: providers={}, interval={}", adapters.size(), interval);
        }
    }

    /**
     * Probes a provider and waits for the updated health.
     * Bounded by the probe timeout; never throws for a failing provider.
     */
    public ProviderHealth probe(String providerId) {
        return probeAsync(providerId).join();
    }

    /**
     * Starts a probe, or joins the one already in flight for this provider.
     */
    public CompletableFuture<ProviderHealth> probeAsync(String providerId) {
        ProviderAdapter adapter = adapters.get(providerId);
        AtomicReference<CompletableFuture<ProviderHealth>> slot = healthTable.probeSlot(providerId);
        if (adapter == null || slot == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown provider: " + providerId));
        }

        CompletableFuture<ProviderHealth> fresh = new CompletableFuture<>();
        CompletableFuture<ProviderHealth> existing = slot.compareAndExchange(null, fresh);
        if (existing != null) {
            log.debug("Probe already in flight, joining: providerId={}", providerId);
            return existing;
        }

        log.debug("Health probe started: providerId={}", providerId);
        observe(providerId, adapter).whenComplete((observation, ex) -> {
            ProviderHealth observed = ex == null
                    ? observation
                    : ProviderHealth.unhealthy(providerId, "probe failed: " + ProviderHttpClient.unwrap(ex).getMessage());
            ProviderHealth recorded = recordProbe(providerId, observed);
            slot.set(null);
            fresh.complete(recorded);
        });
        return fresh;
    }

    /**
     * Last known health; never blocks.
     */
    public ProviderHealth currentStatus(String providerId) {
        return healthTable.get(providerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + providerId));
    }

    /**
     * Records a failed live call and triggers an immediate probe.
     * Request-shape failures say nothing about the provider and are ignored.
     */
    public void reportCallFailure(String providerId, ErrorKind kind) {
        if (!kind.isFailoverEligible()) {
            log.debug("Call failure not health-relevant: providerId={}, kind={}", providerId, kind);
            return;
        }
        healthTable.update(providerId, previous -> new ProviderHealth(
                providerId,
                previous.status() == HealthStatus.HEALTHY ? HealthStatus.DEGRADED : previous.status(),
                Instant.now(),
                previous.lastResponseTimeMs(),
                "call failed: " + kind.wireName(),
                previous.consecutiveFailures()
        )).ifPresent(transition -> {
            logTransition(transition);
            probeAsync(providerId);
        });
    }

    public ProviderHealthTable getHealthTable() {
        return healthTable;
    }

    private CompletableFuture<ProviderHealth> observe(String providerId, ProviderAdapter adapter) {
        CompletableFuture<ProviderHealth> check;
        try {
            check = adapter.healthCheck();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    ProviderHealth.unhealthy(providerId, "probe failed: " + e.getMessage()));
        }
        CompletableFuture<ProviderHealth> bounded = check.copy()
                .completeOnTimeout(ProviderHealth.unhealthy(providerId, "probe timed out"),
                        probeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        // abort the probe exchange if our own timeout won
        bounded.whenComplete((health, ex) -> check.cancel(true));
        return bounded;
    }

    private ProviderHealth recordProbe(String providerId, ProviderHealth observation) {
        return healthTable.update(providerId, previous -> {
            Instant checkedAt = observation.lastCheckedAt() != null ? observation.lastCheckedAt() : Instant.now();
            if (observation.isHealthy()) {
                return new ProviderHealth(providerId, HealthStatus.HEALTHY, checkedAt,
                        observation.lastResponseTimeMs(), observation.detail(), 0);
            }
            int failures = previous.consecutiveFailures() + 1;
            HealthStatus status = failures >= unhealthyThreshold ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
            return new ProviderHealth(providerId, status, checkedAt,
                    observation.lastResponseTimeMs(), observation.detail(), failures);
        }).map(transition -> {
            logTransition(transition);
            return transition.current();
        }).orElse(observation);
    }

    private void logTransition(ProviderHealthTable.Transition transition) {
        ProviderHealth current = transition.current();
        if (transition.statusChanged()) {
            log.info("Provider health changed: providerId={}, previousHealth={}, newHealth={}, consecutiveFailures={}, detail={}",
                    current.providerId(), transition.previous().status(), current.status(),
                    current.consecutiveFailures(), current.detail());
        } else if (current.status() != HealthStatus.HEALTHY) {
            log.warn("Provider still {}: providerId={}, consecutiveFailures={}, detail={}",
                    current.status(), current.providerId(), current.consecutiveFailures(), current.detail());
        } else {
            log.debug("Health probe passed: providerId={}, latencyMs={}",
                    current.providerId(), current.lastResponseTimeMs());
        }
    }

    @Override
    public void close() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }
}
