package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Rejects malformed requests before any provider is contacted.
 *
 * Validates:
 * - Model name is present and, if a whitelist is configured, allowed
 * - At least one message is present
 * - Total content length is within limits
 * - Sampling parameters are in range
 */
public final class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    private final Set<String> allowedModels;
    private final int maxContentLength;

    public RequestValidator(Set<String> allowedModels, int maxContentLength) {
        this.allowedModels = Set.copyOf(allowedModels);
        this.maxContentLength = maxContentLength;
    }

    /**
     * Creates a validator with no model restrictions and default content length.
     */
    public static RequestValidator withDefaults() {
        return new RequestValidator(Set.of(), 100_000);
    }

    /**
     * @throws RoutingException INVALID_REQUEST describing the first violation
     */
    public void validate(CanonicalRequest request) {
        String reason = violation(request);
        if (reason != null) {
            log.warn("Validation failed: requestId={}, model={}, reason={}", request.id(), request.model(), reason);
            throw RoutingException.invalidRequest(request.id(), reason);
        }
    }

    private String violation(CanonicalRequest request) {
        String model = request.model();
        if (model == null || model.isBlank()) {
            return "Model name is required";
        }

        // Check model whitelist if configured
        if (!allowedModels.isEmpty() && !allowedModels.contains(model)) {
            return "Model not allowed: " + model;
        }

        if (request.messages().isEmpty()) {
            return "At least one message is required";
        }
        if (request.contentLength() > maxContentLength) {
            return "Content exceeds maximum length of " + maxContentLength;
        }

        if (request.maxTokens() <= 0) {
            return "maxTokens must be positive";
        }
        if (request.temperature() < 0 || request.temperature() > 2) {
            return "temperature must be between 0 and 2";
        }
        if (request.topP() <= 0 || request.topP() > 1) {
            return "topP must be in (0, 1]";
        }
        return null;
    }
}
