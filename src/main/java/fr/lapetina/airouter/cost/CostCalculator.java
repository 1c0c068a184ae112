package fr.lapetina.airouter.cost;

import fr.lapetina.airouter.domain.exception.UnknownPricingException;
import fr.lapetina.airouter.domain.model.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts token usage into a monetary cost.
 * Pure function of the price table; holds no per-request state.
 */
public final class CostCalculator {

    private static final Logger log = LoggerFactory.getLogger(CostCalculator.class);

    private final PriceTable priceTable;

    public CostCalculator(PriceTable priceTable) {
        this.priceTable = Objects.requireNonNull(priceTable, "Price table is required");
    }

    /**
     * @throws UnknownPricingException if no price is configured for the pair
     */
    public BigDecimal cost(Usage usage, String providerId, String model) {
        return priceTable.find(providerId, model)
                .orElseThrow(() -> new UnknownPricingException(providerId, model))
                .cost(usage);
    }

    /**
     * Prices usage under the configured model name first, then under the name the vendor
     * reported, which often carries a version suffix.
     *
     * @return empty when neither name is priced
     */
    public Optional<BigDecimal> costIfPriced(Usage usage, String providerId, String configuredModel, String reportedModel) {
        try {
            return Optional.of(cost(usage, providerId, configuredModel));
        } catch (UnknownPricingException e) {
            if (reportedModel == null || reportedModel.equals(configuredModel)) {
                log.debug("Cost unavailable: providerId={}, model={}", providerId, configuredModel);
                return Optional.empty();
            }
        }
        Optional<Pricing> reported = priceTable.find(providerId, reportedModel);
        if (reported.isEmpty()) {
            log.debug("Cost unavailable: providerId={}, model={}, reportedModel={}",
                    providerId, configuredModel, reportedModel);
        }
        return reported.map(pricing -> pricing.cost(usage));
    }

    public PriceTable getPriceTable() {
        return priceTable;
    }
}
