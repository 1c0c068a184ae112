package fr.lapetina.airouter.infrastructure.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class RouterConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private List<ModelConfig> models = new ArrayList<>();
    private List<PriceConfig> pricing = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private ValidationConfig validation = new ValidationConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private EventsConfig events = new EventsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public List<PriceConfig> getPricing() { return pricing; }
    public void setPricing(List<PriceConfig> pricing) { this.pricing = pricing; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One upstream provider.
     */
    public static class ProviderConfig {
        private String id;
        private String type;
        private String baseUrl;
        private String apiKey;
        private String apiVersion;
        private String organization;
        private long timeoutMs = 30000;
        private long healthCheckTimeoutMs = 5000;
        private int maxConcurrentRequests = 32;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiVersion() { return apiVersion; }
        public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }

        public String getOrganization() { return organization; }
        public void setOrganization(String organization) { this.organization = organization; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Logical model alias and its ordered {@code provider/model} candidates.
     */
    public static class ModelConfig {
        private String name;
        private List<String> candidates = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getCandidates() { return candidates; }
        public void setCandidates(List<String> candidates) { this.candidates = candidates; }
    }

    /**
     * Price of one provider/model pair, per million tokens.
     */
    public static class PriceConfig {
        private String provider;
        private String model;
        private double promptPerMillion;
        private double completionPerMillion;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getPromptPerMillion() { return promptPerMillion; }
        public void setPromptPerMillion(double promptPerMillion) { this.promptPerMillion = promptPerMillion; }

        public double getCompletionPerMillion() { return completionPerMillion; }
        public void setCompletionPerMillion(double completionPerMillion) { this.completionPerMillion = completionPerMillion; }
    }

    /**
     * Failover timing and the optional cost ceiling.
     */
    public static class RoutingConfig {
        private long attemptTimeoutMs = 30000;
        private long overallDeadlineMs = 0;
        private Double maxRequestCost;

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }

        /**
         * Zero means three times the attempt timeout.
         */
        public long getOverallDeadlineMs() { return overallDeadlineMs; }
        public void setOverallDeadlineMs(long overallDeadlineMs) { this.overallDeadlineMs = overallDeadlineMs; }

        public long effectiveOverallDeadlineMs() {
            return overallDeadlineMs > 0 ? overallDeadlineMs : attemptTimeoutMs * 3;
        }

        public Double getMaxRequestCost() { return maxRequestCost; }
        public void setMaxRequestCost(Double maxRequestCost) { this.maxRequestCost = maxRequestCost; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30000;
        private int unhealthyThreshold = 3;
        private long timeoutMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public int getUnhealthyThreshold() { return unhealthyThreshold; }
        public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxContentLength = 100000;
        private Set<String> allowedModels = new HashSet<>();

        public int getMaxContentLength() { return maxContentLength; }
        public void setMaxContentLength(int maxContentLength) { this.maxContentLength = maxContentLength; }

        public Set<String> getAllowedModels() { return allowedModels; }
        public void setAllowedModels(Set<String> allowedModels) { this.allowedModels = allowedModels; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * LMAX Disruptor settings for the routing event bus.
     */
    public static class EventsConfig {
        private boolean enabled = true;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_router";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
