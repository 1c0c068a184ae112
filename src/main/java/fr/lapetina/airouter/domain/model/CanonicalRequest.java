package fr.lapetina.airouter.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Provider-agnostic inference request.
 * Immutable and thread-safe; adapters translate it into their vendor wire format.
 *
 * @param model logical model alias or provider-qualified {@code provider/model}
 * @param stop  ordered stop sequences, empty when none
 */
public record CanonicalRequest(
        String id,
        String userId,
        List<Message> messages,
        String model,
        int maxTokens,
        double temperature,
        double topP,
        Set<String> stop,
        boolean stream
) {
    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final double DEFAULT_TOP_P = 1.0;

    public CanonicalRequest {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
        stop = stop != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(stop))
                : Set.of();
    }

    /**
     * Returns a copy targeting a different (vendor-specific) model name.
     */
    public CanonicalRequest withModel(String providerModel) {
        return new CanonicalRequest(id, userId, messages, providerModel,
                maxTokens, temperature, topP, stop, stream);
    }

    /**
     * Returns a copy with the stream flag set.
     */
    public CanonicalRequest withStream(boolean streaming) {
        return new CanonicalRequest(id, userId, messages, model,
                maxTokens, temperature, topP, stop, streaming);
    }

    /**
     * Total characters across all message contents.
     */
    public int contentLength() {
        int total = 0;
        for (Message message : messages) {
            total += message.content() != null ? message.content().length() : 0;
        }
        return total;
    }

    /**
     * Single conversation turn.
     */
    public record Message(Role role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }

        public static Message system(String content) {
            return new Message(Role.SYSTEM, content);
        }

        public static Message user(String content) {
            return new Message(Role.USER, content);
        }

        public static Message assistant(String content) {
            return new Message(Role.ASSISTANT, content);
        }
    }

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT;

        /**
         * Lower-case name as used on most vendor wires.
         */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private final List<Message> messages = new ArrayList<>();
        private String model;
        private int maxTokens = DEFAULT_MAX_TOKENS;
        private double temperature = DEFAULT_TEMPERATURE;
        private double topP = DEFAULT_TOP_P;
        private Collection<String> stop;
        private boolean stream;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder message(Message message) {
            this.messages.add(message);
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(double topP) {
            this.topP = topP;
            return this;
        }

        public Builder stop(Collection<String> stop) {
            this.stop = stop;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public CanonicalRequest build() {
            return new CanonicalRequest(
                    id, userId, messages, model, maxTokens, temperature, topP,
                    stop != null ? new LinkedHashSet<>(stop) : null, stream
            );
        }
    }
}
