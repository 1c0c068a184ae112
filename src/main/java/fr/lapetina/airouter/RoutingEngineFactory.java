package fr.lapetina.airouter;

import fr.lapetina.airouter.infrastructure.config.ConfigLoader;
import fr.lapetina.airouter.infrastructure.config.RouterConfig;
import fr.lapetina.airouter.infrastructure.events.DisruptorEventSink;
import fr.lapetina.airouter.infrastructure.health.HealthMonitor;
import fr.lapetina.airouter.infrastructure.health.ProviderHealthTable;
import fr.lapetina.airouter.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouter.provider.ProviderAdapter;
import fr.lapetina.airouter.provider.ProviderAdapterFactory;
import fr.lapetina.airouter.provider.ProviderEndpoint;
import fr.lapetina.airouter.provider.ProviderType;
import fr.lapetina.airouter.routing.FailoverRouter;
import fr.lapetina.airouter.routing.RoutingEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for creating a fully-wired routing engine from configuration.
 * This is the primary entry point for obtaining a configured {@link FailoverRouter}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RoutingEngineFactory engine = RoutingEngineFactory.create("config.yaml").start()) {
 *     CanonicalResponse response = engine.getRouter().route(request);
 * }
 * }</pre>
 */
public class RoutingEngineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngineFactory.class);

    private final RouterConfig config;
    private final MetricsRegistry metricsRegistry;
    private final Map<String, ProviderAdapter> adapters;
    private final ProviderHealthTable healthTable;
    private final HealthMonitor healthMonitor;
    private final DisruptorEventSink eventSink;
    private final FailoverRouter router;

    /**
     * @param adapterOverrides adapters to use instead of the configured ones, by provider id
     */
    protected RoutingEngineFactory(String configPath, Map<String, ProviderAdapter> adapterOverrides) {
        log.info("Initializing RoutingEngineFactory from config: {}", configPath);

        // Load configuration
        this.config = new ConfigLoader(configPath).load();

        // Initialize metrics
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        // Create one adapter per enabled provider (allow override for testing)
        this.adapters = createAdapters(adapterOverrides);

        // Initialize health tracking
        this.healthTable = new ProviderHealthTable();
        this.healthMonitor = new HealthMonitor(
                adapters,
                healthTable,
                Duration.ofMillis(config.getHealthCheck().getTimeoutMs()),
                config.getHealthCheck().getUnhealthyThreshold()
        );

        // Event bus feeding metrics and the audit log
        this.eventSink = config.getEvents().isEnabled()
                ? DisruptorEventSink.builder()
                        .fromConfig(config)
                        .metricsRegistry(metricsRegistry)
                        .build()
                : null;

        // Build router
        this.router = FailoverRouter.builder()
                .fromConfig(config)
                .adapters(adapters)
                .healthMonitor(healthMonitor)
                .eventSink(eventSink != null ? eventSink : RoutingEventSink.NOOP)
                .build();

        registerProviderMetrics();

        log.info("RoutingEngineFactory initialized with {} providers", adapters.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static RoutingEngineFactory create(String configPath) {
        return new RoutingEngineFactory(configPath, Map.of());
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static RoutingEngineFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the event consumers and background health probing.
     */
    public RoutingEngineFactory start() {
        if (eventSink != null) {
            eventSink.start();
        }
        if (config.getHealthCheck().isEnabled()) {
            healthMonitor.startBackgroundProbing(Duration.ofMillis(config.getHealthCheck().getIntervalMs()));
        }
        log.info("Routing engine started");
        return this;
    }

    public FailoverRouter getRouter() {
        return router;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    /**
     * @return null when metrics are disabled
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public Map<String, ProviderAdapter> getAdapters() {
        return adapters;
    }

    public RouterConfig getConfig() {
        return config;
    }

    /**
     * Builds the endpoint description of a configured provider.
     */
    static ProviderEndpoint toEndpoint(RouterConfig.ProviderConfig provider) {
        return ProviderEndpoint.builder()
                .id(provider.getId())
                .type(ProviderType.fromName(provider.getType())
                        .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                                "Unknown provider type: " + provider.getType())))
                .baseUrl(provider.getBaseUrl())
                .apiKey(provider.getApiKey())
                .apiVersion(provider.getApiVersion())
                .organization(provider.getOrganization())
                .timeout(Duration.ofMillis(provider.getTimeoutMs()))
                .healthCheckTimeout(Duration.ofMillis(provider.getHealthCheckTimeoutMs()))
                .maxConcurrentRequests(provider.getMaxConcurrentRequests())
                .build();
    }

    private Map<String, ProviderAdapter> createAdapters(Map<String, ProviderAdapter> overrides) {
        Duration connectTimeout = Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs());
        Map<String, ProviderAdapter> created = new LinkedHashMap<>();
        for (RouterConfig.ProviderConfig provider : config.getProviders()) {
            if (!provider.isEnabled()) {
                log.info("Provider disabled, skipping: providerId={}", provider.getId());
                continue;
            }
            ProviderAdapter adapter = overrides.get(provider.getId());
            if (adapter == null) {
                ProviderEndpoint endpoint = toEndpoint(provider);
                adapter = ProviderAdapterFactory.create(endpoint, connectTimeout)
                        .orElseThrow(() -> new ConfigLoader.ConfigurationException(
                                "No adapter for provider type: " + endpoint.type()));
                log.debug("Registered provider: {}", endpoint);
            }
            created.put(provider.getId(), adapter);
        }
        if (created.isEmpty()) {
            throw new ConfigLoader.ConfigurationException("No enabled provider configured");
        }
        return Map.copyOf(created);
    }

    private void registerProviderMetrics() {
        if (metricsRegistry == null) {
            return;
        }
        for (String providerId : adapters.keySet()) {
            metricsRegistry.registerProviderHealth(providerId,
                    () -> healthTable.statusOf(providerId).gaugeValue());
        }
    }

    @Override
    public void close() {
        log.info("Shutting down RoutingEngineFactory...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        try {
            router.close();
        } catch (Exception e) {
            log.warn("Error closing router", e);
        }

        if (eventSink != null) {
            try {
                eventSink.close();
            } catch (Exception e) {
                log.warn("Error closing event sink", e);
            }
        }

        for (ProviderAdapter adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (Exception e) {
                log.warn("Error closing adapter: providerId={}", adapter.id(), e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("RoutingEngineFactory shut down");
    }
}
