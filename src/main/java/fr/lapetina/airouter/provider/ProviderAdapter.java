package fr.lapetina.airouter.provider;

import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.CanonicalResponse;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.streaming.CompletionStream;

import java.util.concurrent.CompletableFuture;

/**
 * Capability interface implemented once per upstream vendor.
 *
 * <p>An adapter translates a {@link CanonicalRequest} into its vendor's wire format, performs
 * the HTTP call and maps the result back. Failures complete the future exceptionally with a
 * classified {@link fr.lapetina.airouter.domain.exception.ProviderException}. Cancelling a
 * returned future, or completing it exceptionally, aborts the underlying exchange.
 *
 * <p>Implementations must be thread-safe; one instance serves all requests for its provider.
 */
public interface ProviderAdapter extends AutoCloseable {

    /**
     * Configured provider id, e.g. {@code openai}.
     */
    String id();

    /**
     * Performs a non-streaming completion. The request's model is the vendor model name.
     */
    CompletableFuture<CanonicalResponse> process(CanonicalRequest request);

    /**
     * Opens a streaming completion; the future completes once the vendor accepted the call.
     */
    CompletableFuture<CompletionStream> openStream(CanonicalRequest request);

    /**
     * Checks the vendor endpoint. Never completes exceptionally: failures are reported
     * as degraded or unhealthy observations.
     */
    CompletableFuture<ProviderHealth> healthCheck();

    @Override
    default void close() {
    }
}
