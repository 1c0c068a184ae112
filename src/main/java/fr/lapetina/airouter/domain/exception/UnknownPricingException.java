package fr.lapetina.airouter.domain.exception;

/**
 * No price is configured for a provider/model pair.
 */
public class UnknownPricingException extends RuntimeException {

    private final String providerId;
    private final String model;

    public UnknownPricingException(String providerId, String model) {
        super("No pricing configured: provider=" + providerId + ", model=" + model);
        this.providerId = providerId;
        this.model = model;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModel() {
        return model;
    }
}
