package fr.lapetina.airouter.cost;

import fr.lapetina.airouter.infrastructure.config.RouterConfig;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable price lookup keyed by provider id and vendor model name.
 */
public final class PriceTable {

    private final Map<String, Pricing> prices;

    private PriceTable(Map<String, Pricing> prices) {
        this.prices = Map.copyOf(prices);
    }

    public static PriceTable empty() {
        return new PriceTable(Map.of());
    }

    public static PriceTable fromConfig(List<RouterConfig.PriceConfig> pricing) {
        Builder builder = builder();
        for (RouterConfig.PriceConfig price : pricing) {
            builder.price(price.getProvider(), price.getModel(),
                    Pricing.perMillion(price.getPromptPerMillion(), price.getCompletionPerMillion()));
        }
        return builder.build();
    }

    public Optional<Pricing> find(String providerId, String model) {
        if (providerId == null || model == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(prices.get(key(providerId, model)));
    }

    public int size() {
        return prices.size();
    }

    private static String key(String providerId, String model) {
        return providerId + "/" + model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, Pricing> prices = new HashMap<>();

        public Builder price(String providerId, String model, Pricing pricing) {
            if (providerId == null || model == null) {
                throw new IllegalArgumentException("Pricing needs a provider and a model");
            }
            prices.put(key(providerId, model), pricing);
            return this;
        }

        public Builder perMillion(String providerId, String model, double prompt, double completion) {
            return price(providerId, model, Pricing.perMillion(prompt, completion));
        }

        public PriceTable build() {
            return new PriceTable(prices);
        }
    }
}
