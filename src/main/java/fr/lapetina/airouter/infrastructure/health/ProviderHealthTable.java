package fr.lapetina.airouter.infrastructure.health;

import fr.lapetina.airouter.domain.model.HealthStatus;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Live health table read by every routing decision.
 *
 * Thread-safe: each provider's snapshot is a single atomic reference, so readers never
 * block and writers replace the whole record at once.
 */
public final class ProviderHealthTable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTable.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    /**
     * Registers a provider with an initial healthy entry. Re-registering keeps the current entry.
     */
    public void register(String providerId) {
        if (entries.putIfAbsent(providerId, new Entry(ProviderHealth.initial(providerId))) == null) {
            log.info("Provider registered for health tracking: providerId={}", providerId);
        }
    }

    /**
     * Last known health, or empty for an unregistered provider.
     */
    public Optional<ProviderHealth> get(String providerId) {
        Entry entry = entries.get(providerId);
        return entry == null ? Optional.empty() : Optional.of(entry.health.get());
    }

    /**
     * Last known status; unknown providers are reported healthy so they keep their position.
     */
    public HealthStatus statusOf(String providerId) {
        return get(providerId).map(ProviderHealth::status).orElse(HealthStatus.HEALTHY);
    }

    public List<ProviderHealth> snapshot() {
        List<ProviderHealth> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.health.get());
        }
        return result;
    }

    public Set<String> providerIds() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Atomically replaces a provider's health.
     *
     * @return the previous and new snapshots, or empty for an unregistered provider
     */
    Optional<Transition> update(String providerId, UnaryOperator<ProviderHealth> change) {
        Entry entry = entries.get(providerId);
        if (entry == null) {
            return Optional.empty();
        }
        while (true) {
            ProviderHealth previous = entry.health.get();
            ProviderHealth next = change.apply(previous);
            if (entry.health.compareAndSet(previous, next)) {
                return Optional.of(new Transition(previous, next));
            }
        }
    }

    /**
     * Slot holding the single in-flight probe of a provider.
     */
    AtomicReference<CompletableFuture<ProviderHealth>> probeSlot(String providerId) {
        Entry entry = entries.get(providerId);
        return entry == null ? null : entry.inFlightProbe;
    }

    /**
     * Before and after snapshots of one update.
     */
    record Transition(ProviderHealth previous, ProviderHealth current) {
        boolean statusChanged() {
            return previous.status() != current.status();
        }
    }

    private static final class Entry {
        private final AtomicReference<ProviderHealth> health;
        private final AtomicReference<CompletableFuture<ProviderHealth>> inFlightProbe = new AtomicReference<>();

        private Entry(ProviderHealth initial) {
            this.health = new AtomicReference<>(initial);
        }
    }
}
