package fr.lapetina.airouter.provider;

import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.streaming.CompletionStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Stateless helpers shared by the adapters.
 */
public final class AdapterSupport {

    private static final Logger log = LoggerFactory.getLogger(AdapterSupport.class);

    private AdapterSupport() {
    }

    /**
     * Turns the HTTP status of a probe into a health observation.
     * 2xx is healthy, any other status degraded, no answer unhealthy.
     * The returned future never completes exceptionally.
     */
    public static CompletableFuture<ProviderHealth> observeProbe(
            String providerId,
            CompletableFuture<Integer> probe,
            long startNanos
    ) {
        return probe.handle((status, ex) -> {
            long elapsedMs = elapsedMs(startNanos);
            if (ex != null) {
                Throwable cause = ProviderHttpClient.unwrap(ex);
                String detail = cause instanceof ProviderException pe && pe.getKind() == ErrorKind.TIMEOUT
                        ? "probe timed out"
                        : "probe failed: " + cause.getMessage();
                log.warn("Health check error: providerId={}, error={}", providerId, detail);
                return ProviderHealth.unhealthy(providerId, detail);
            }
            if (status >= 200 && status < 300) {
                log.debug("Health check passed: providerId={}, status={}, latencyMs={}", providerId, status, elapsedMs);
                return ProviderHealth.healthy(providerId, elapsedMs);
            }
            log.warn("Health check failed: providerId={}, status={}", providerId, status);
            return ProviderHealth.degraded(providerId, elapsedMs, "HTTP " + status);
        });
    }

    /**
     * Wraps an opened response body into a completion stream, closing the body if the
     * caller has already abandoned the call by the time it arrives.
     */
    public static CompletableFuture<CompletionStream> linkStream(
            CompletableFuture<InputStream> upstream,
            Function<InputStream, CompletionStream> wrap
    ) {
        CompletableFuture<CompletionStream> downstream = new CompletableFuture<>();
        upstream.whenComplete((body, ex) -> {
            if (ex != null) {
                downstream.completeExceptionally(ProviderHttpClient.unwrap(ex));
                return;
            }
            CompletionStream stream;
            try {
                stream = wrap.apply(body);
            } catch (RuntimeException e) {
                closeBody(body);
                downstream.completeExceptionally(e);
                return;
            }
            if (!downstream.complete(stream)) {
                stream.close();
            }
        });
        downstream.whenComplete((stream, ex) -> {
            if (ex != null && !upstream.isDone()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }

    public static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void closeBody(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Error closing response body", e);
        }
    }
}
