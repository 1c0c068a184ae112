package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.cost.PriceTable;
import fr.lapetina.airouter.cost.Pricing;
import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Refuses requests whose worst-case cost exceeds the configured ceiling.
 *
 * The estimate assumes four characters per prompt token and the full {@code maxTokens}
 * completion, priced at the first candidate that has a price.
 */
public final class BudgetGuard {

    private static final Logger log = LoggerFactory.getLogger(BudgetGuard.class);

    private static final int CHARS_PER_TOKEN = 4;

    private final PriceTable priceTable;
    private final BigDecimal maxRequestCost;

    /**
     * @param maxRequestCost null disables the check
     */
    public BudgetGuard(PriceTable priceTable, BigDecimal maxRequestCost) {
        this.priceTable = priceTable;
        this.maxRequestCost = maxRequestCost;
    }

    public static BudgetGuard disabled() {
        return new BudgetGuard(PriceTable.empty(), null);
    }

    /**
     * @throws RoutingException BUDGET_EXCEEDED when the estimate is above the ceiling
     */
    public void check(CanonicalRequest request, List<Candidate> candidates) {
        if (maxRequestCost == null) {
            return;
        }
        Optional<BigDecimal> estimate = estimate(request, candidates);
        if (estimate.isEmpty()) {
            log.debug("Budget check skipped, no priced candidate: requestId={}", request.id());
            return;
        }
        if (estimate.get().compareTo(maxRequestCost) > 0) {
            log.warn("Budget exceeded: requestId={}, estimatedCost={}, maxRequestCost={}",
                    request.id(), estimate.get(), maxRequestCost);
            throw RoutingException.budgetExceeded(request.id(),
                    "Estimated cost " + estimate.get().toPlainString()
                            + " exceeds maximum " + maxRequestCost.toPlainString());
        }
    }

    /**
     * Worst-case cost at the first priced candidate.
     */
    public Optional<BigDecimal> estimate(CanonicalRequest request, List<Candidate> candidates) {
        long promptTokens = estimatePromptTokens(request);
        for (Candidate candidate : candidates) {
            Optional<Pricing> pricing = priceTable.find(candidate.providerId(), candidate.model());
            if (pricing.isPresent()) {
                return Optional.of(pricing.get().cost(promptTokens, request.maxTokens()));
            }
        }
        return Optional.empty();
    }

    static long estimatePromptTokens(CanonicalRequest request) {
        return (request.contentLength() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
