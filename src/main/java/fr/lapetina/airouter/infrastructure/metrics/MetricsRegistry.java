package fr.lapetina.airouter.infrastructure.metrics;

import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency per provider, outcome and error kind
 * - Request counters and end-to-end latency per model
 * - Failover, token and cost counters
 * - Provider health gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failoverCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> tokenCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> costCounters = new ConcurrentHashMap<>();

    private final Counter droppedEvents;
    private final AtomicInteger ringBufferRemaining = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.droppedEvents = Counter.builder(prefix + "_events_dropped_total")
                .description("Routing events dropped because the ring buffer was full")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicInteger::get)
                .description("Remaining capacity in the event ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ai_router");
    }

    /**
     * Counts one provider attempt and records its latency.
     *
     * @param kind null for successful attempts
     */
    public void recordAttempt(String providerId, RoutingAttempt.Outcome outcome, ErrorKind kind, Duration latency) {
        String kindTag = kind != null ? kind.wireName() : "none";
        String key = providerId + ":" + outcome.name() + ":" + kindTag;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Provider attempts by outcome")
                        .tag("provider", providerId)
                        .tag("outcome", outcome.name().toLowerCase())
                        .tag("kind", kindTag)
                        .register(registry)
        ).increment();

        attemptTimers.computeIfAbsent(providerId, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Provider attempt latency")
                        .tag("provider", providerId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a finished request and records its end-to-end latency.
     *
     * @param status {@code success} or the routing failure kind
     */
    public void recordRequest(String model, String status, Duration latency) {
        String key = model + ":" + status;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of routed requests")
                        .tag("model", model)
                        .tag("status", status)
                        .register(registry)
        ).increment();

        requestTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("End-to-end routing latency")
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    public void incrementFailover(String fromProvider, String toProvider) {
        String key = fromProvider + ":" + toProvider;
        failoverCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_failovers_total")
                        .description("Failovers between providers")
                        .tag("from", fromProvider)
                        .tag("to", toProvider)
                        .register(registry)
        ).increment();
    }

    public void recordTokens(String providerId, String model, Usage usage) {
        tokenCounter(providerId, model, "prompt").increment(usage.promptTokens());
        tokenCounter(providerId, model, "completion").increment(usage.completionTokens());
    }

    public void recordCost(String providerId, String model, BigDecimal cost) {
        String key = providerId + ":" + model;
        costCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_cost_total")
                        .description("Accumulated request cost")
                        .tag("provider", providerId)
                        .tag("model", model)
                        .register(registry)
        ).increment(cost.doubleValue());
    }

    /**
     * Registers a gauge for provider health status.
     */
    public void registerProviderHealth(String providerId, Supplier<Number> healthValue) {
        Gauge.builder(prefix + "_provider_health", healthValue, s -> s.get().doubleValue())
                .description("Provider health status (0=UNHEALTHY, 1=DEGRADED, 2=HEALTHY)")
                .tag("provider", providerId)
                .register(registry);
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    /**
     * Updates the ring buffer remaining capacity.
     */
    public void setRingBufferRemaining(int value) {
        ringBufferRemaining.set(value);
    }

    private Counter tokenCounter(String providerId, String model, String type) {
        String key = providerId + ":" + model + ":" + type;
        return tokenCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_tokens_total")
                        .description("Tokens consumed")
                        .tag("provider", providerId)
                        .tag("model", model)
                        .tag("type", type)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
