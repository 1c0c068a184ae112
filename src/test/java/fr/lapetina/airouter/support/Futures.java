package fr.lapetina.airouter.support;

import fr.lapetina.airouter.domain.exception.ProviderException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Assertion helpers for adapter futures.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Waits for the future and returns the provider failure it completed with.
     */
    public static ProviderException providerFailure(CompletableFuture<?> future) throws InterruptedException, TimeoutException {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ProviderException providerException) {
                return providerException;
            }
            throw new AssertionError("Expected ProviderException but got " + e.getCause(), e.getCause());
        }
        throw new AssertionError("Expected the future to fail");
    }
}
