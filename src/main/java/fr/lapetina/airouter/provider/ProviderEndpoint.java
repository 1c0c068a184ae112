package fr.lapetina.airouter.provider;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Static description of one configured provider: where it lives, how to authenticate
 * and how long calls may take.
 */
public record ProviderEndpoint(
        String id,
        ProviderType type,
        URI baseUrl,
        String apiKey,
        String apiVersion,
        String organization,
        Duration timeout,
        Duration healthCheckTimeout,
        int maxConcurrentRequests
) {
    public ProviderEndpoint {
        Objects.requireNonNull(id, "Provider id is required");
        Objects.requireNonNull(type, "Provider type is required");
        Objects.requireNonNull(baseUrl, "Base URL is required");
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (healthCheckTimeout == null) {
            healthCheckTimeout = Duration.ofSeconds(5);
        }
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be at least 1: " + id);
        }
    }

    /**
     * New identifier for one outbound call; never reused across attempts.
     */
    public String newCallId() {
        return id + "_" + UUID.randomUUID();
    }

    /**
     * Resolves a path against the base URL, tolerating a trailing slash on either side.
     */
    public URI resolve(String path) {
        String base = baseUrl.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String suffix = path.startsWith("/") ? path : "/" + path;
        return URI.create(base + suffix);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        // keeps the credential out of logs
        return "ProviderEndpoint{id=" + id + ", type=" + type + ", baseUrl=" + baseUrl
                + ", timeout=" + timeout + ", maxConcurrentRequests=" + maxConcurrentRequests + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderType type;
        private URI baseUrl;
        private String apiKey;
        private String apiVersion;
        private String organization;
        private Duration timeout;
        private Duration healthCheckTimeout;
        private int maxConcurrentRequests = 32;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(ProviderType type) {
            this.type = type;
            return this;
        }

        public Builder baseUrl(String url) {
            this.baseUrl = URI.create(url);
            return this;
        }

        public Builder baseUrl(URI url) {
            this.baseUrl = url;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public Builder maxConcurrentRequests(int max) {
            this.maxConcurrentRequests = max;
            return this;
        }

        public ProviderEndpoint build() {
            return new ProviderEndpoint(id, type, baseUrl, apiKey, apiVersion, organization,
                    timeout, healthCheckTimeout, maxConcurrentRequests);
        }
    }
}
