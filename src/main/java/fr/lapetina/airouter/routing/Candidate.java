package fr.lapetina.airouter.routing;

import java.util.Objects;

/**
 * One provider and the vendor model name to request from it.
 */
public record Candidate(String providerId, String model) {

    public Candidate {
        Objects.requireNonNull(providerId, "Provider id is required");
        Objects.requireNonNull(model, "Model is required");
    }

    /**
     * Parses {@code provider/model}; the model part may itself contain slashes.
     *
     * @throws IllegalArgumentException if either part is missing
     */
    public static Candidate parse(String qualified) {
        int slash = qualified == null ? -1 : qualified.indexOf('/');
        if (slash <= 0 || slash == qualified.length() - 1) {
            throw new IllegalArgumentException("Expected 'provider/model': " + qualified);
        }
        return new Candidate(qualified.substring(0, slash), qualified.substring(slash + 1));
    }

    @Override
    public String toString() {
        return providerId + "/" + model;
    }
}
