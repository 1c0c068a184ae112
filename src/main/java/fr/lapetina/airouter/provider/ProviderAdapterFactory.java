package fr.lapetina.airouter.provider;

import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.provider.anthropic.AnthropicAdapter;
import fr.lapetina.airouter.provider.gemini.GeminiAdapter;
import fr.lapetina.airouter.provider.ollama.OllamaAdapter;
import fr.lapetina.airouter.provider.openai.OpenAiAdapter;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Registry of adapter constructors keyed by wire protocol.
 *
 * Each adapter gets its own {@link ProviderHttpClient}, so connection pools and concurrency
 * slots are never shared between providers.
 */
public final class ProviderAdapterFactory {

    private static final Map<ProviderType, BiFunction<ProviderEndpoint, ProviderHttpClient, ProviderAdapter>> REGISTRY =
            new ConcurrentHashMap<>();

    static {
        // Register built-in adapters
        register(ProviderType.OPENAI, OpenAiAdapter::new);
        register(ProviderType.ANTHROPIC, AnthropicAdapter::new);
        register(ProviderType.GEMINI, GeminiAdapter::new);
        register(ProviderType.OLLAMA, OllamaAdapter::new);
    }

    private ProviderAdapterFactory() {
        // Utility class
    }

    /**
     * Registers or replaces the adapter constructor for a protocol.
     */
    public static void register(
            ProviderType type,
            BiFunction<ProviderEndpoint, ProviderHttpClient, ProviderAdapter> constructor
    ) {
        REGISTRY.put(type, constructor);
    }

    /**
     * Creates an adapter with a dedicated HTTP client.
     *
     * @param connectTimeout TCP connect timeout for the new client
     * @return adapter instance, or empty if no constructor is registered for the type
     */
    public static Optional<ProviderAdapter> create(ProviderEndpoint endpoint, Duration connectTimeout) {
        BiFunction<ProviderEndpoint, ProviderHttpClient, ProviderAdapter> constructor = REGISTRY.get(endpoint.type());
        if (constructor == null) {
            return Optional.empty();
        }
        ProviderHttpClient http = new ProviderHttpClient(
                endpoint.id(), connectTimeout, endpoint.maxConcurrentRequests());
        return Optional.of(constructor.apply(endpoint, http));
    }
}
