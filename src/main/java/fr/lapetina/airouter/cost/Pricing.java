package fr.lapetina.airouter.cost;

import fr.lapetina.airouter.domain.model.Usage;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Per-token prices of one provider/model pair.
 */
public record Pricing(BigDecimal promptPerToken, BigDecimal completionPerToken) {

    /** Decimal places kept in computed costs */
    public static final int COST_SCALE = 8;

    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);

    public Pricing {
        Objects.requireNonNull(promptPerToken, "Prompt price is required");
        Objects.requireNonNull(completionPerToken, "Completion price is required");
        if (promptPerToken.signum() < 0 || completionPerToken.signum() < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }

    /**
     * Builds per-token prices from the per-million figures vendors publish.
     */
    public static Pricing perMillion(double promptPerMillion, double completionPerMillion) {
        return new Pricing(
                BigDecimal.valueOf(promptPerMillion).divide(ONE_MILLION, MathContext.DECIMAL64),
                BigDecimal.valueOf(completionPerMillion).divide(ONE_MILLION, MathContext.DECIMAL64)
        );
    }

    public BigDecimal cost(Usage usage) {
        return cost(usage.promptTokens(), usage.completionTokens());
    }

    public BigDecimal cost(long promptTokens, long completionTokens) {
        return promptPerToken.multiply(BigDecimal.valueOf(promptTokens))
                .add(completionPerToken.multiply(BigDecimal.valueOf(completionTokens)))
                .setScale(COST_SCALE, RoundingMode.HALF_UP);
    }
}
