package fr.lapetina.airouter.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider-agnostic completion result.
 * Immutable and thread-safe.
 *
 * @param cost null when pricing is unknown; see {@link ResponseMetadata#costAvailable()}
 */
public record CanonicalResponse(
        String id,
        String provider,
        String model,
        String content,
        Usage usage,
        FinishReason finishReason,
        long responseTimeMs,
        BigDecimal cost,
        ResponseMetadata metadata
) {
    public CanonicalResponse {
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(metadata, "Metadata is required");
        if (content == null) {
            content = "";
        }
        if (usage == null) {
            usage = Usage.EMPTY;
        }
        if (finishReason == null) {
            finishReason = FinishReason.STOP;
        }
    }

    public Optional<BigDecimal> costIfAvailable() {
        return Optional.ofNullable(cost);
    }

    /**
     * Stamps router-level facts onto an adapter's response.
     */
    public CanonicalResponse withRouting(List<String> attemptedProviders, BigDecimal computedCost) {
        return new CanonicalResponse(id, provider, model, content, usage, finishReason, responseTimeMs,
                computedCost, metadata.withRouting(attemptedProviders, computedCost != null));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String provider;
        private String model;
        private String content;
        private Usage usage;
        private FinishReason finishReason;
        private long responseTimeMs;
        private BigDecimal cost;
        private ResponseMetadata metadata;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        public Builder finishReason(FinishReason finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder responseTimeMs(long responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
            return this;
        }

        public Builder cost(BigDecimal cost) {
            this.cost = cost;
            return this;
        }

        public Builder metadata(ResponseMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public CanonicalResponse build() {
            return new CanonicalResponse(id, provider, model, content, usage,
                    finishReason, responseTimeMs, cost, metadata);
        }
    }
}
