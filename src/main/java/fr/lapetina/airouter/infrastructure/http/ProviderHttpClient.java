package fr.lapetina.airouter.infrastructure.http;

import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * HTTP transport shared by the provider adapters (one instance per provider).
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. Every call is bounded by a timer that
 * cancels the in-flight exchange; outbound concurrency is capped by a slot counter and a
 * saturated provider fails fast with {@link ErrorKind#RATE_LIMITED}. Failures always surface
 * as {@link ProviderException}.
 */
public class ProviderHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private final String providerId;
    private final HttpClient httpClient;
    private final int maxConcurrentRequests;
    private final AtomicInteger inFlightRequests = new AtomicInteger(0);
    private final ScheduledExecutorService timer;

    public ProviderHttpClient(String providerId, Duration connectTimeout, int maxConcurrentRequests) {
        this(providerId, HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build(), maxConcurrentRequests);
    }

    protected ProviderHttpClient(String providerId, HttpClient httpClient, int maxConcurrentRequests) {
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("maxConcurrentRequests must be at least 1");
        }
        this.providerId = providerId;
        this.httpClient = httpClient;
        this.maxConcurrentRequests = maxConcurrentRequests;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "provider-timer-" + providerId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Sends a request and completes with the body of a 2xx response.
     * Non-2xx responses are read fully and mapped to a classified {@link ProviderException}.
     */
    public CompletableFuture<String> send(String callId, HttpRequest request, Duration timeout) {
        if (!tryAcquireSlot()) {
            return CompletableFuture.failedFuture(saturated(callId));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: providerId={}, callId={}, uri={}", providerId, callId, request.uri());

        CompletableFuture<HttpResponse<String>> exchange;
        try {
            exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            releaseSlot();
            return CompletableFuture.failedFuture(classify(e, callId));
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        exchange.whenComplete((response, ex) -> {
            releaseSlot();
            long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
            if (ex != null) {
                result.completeExceptionally(classify(ex, callId));
                return;
            }
            int status = response.statusCode();
            if (isSuccess(status)) {
                log.debug("Request successful: providerId={}, callId={}, status={}, latencyMs={}",
                        providerId, callId, status, latencyMs);
                result.complete(response.body());
            } else {
                log.warn("Request failed with HTTP error: providerId={}, callId={}, status={}, latencyMs={}",
                        providerId, callId, status, latencyMs);
                result.completeExceptionally(
                        ProviderException.fromStatus(status, providerId, callId, response.body()));
            }
        });
        bindTimeout(result, exchange, callId, timeout);
        return result;
    }

    /**
     * Opens a streaming response and completes with its body once 2xx headers arrive.
     *
     * <p>The concurrency slot stays held until the returned stream is closed. The timeout
     * covers the wait for response headers only; read deadlines belong to the caller.
     */
    public CompletableFuture<InputStream> openStream(String callId, HttpRequest request, Duration timeout) {
        if (!tryAcquireSlot()) {
            return CompletableFuture.failedFuture(saturated(callId));
        }

        log.debug("Opening stream: providerId={}, callId={}, uri={}", providerId, callId, request.uri());

        CompletableFuture<HttpResponse<InputStream>> exchange;
        try {
            exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (RuntimeException e) {
            releaseSlot();
            return CompletableFuture.failedFuture(classify(e, callId));
        }

        CompletableFuture<InputStream> result = new CompletableFuture<>();
        exchange.whenComplete((response, ex) -> {
            if (ex != null) {
                releaseSlot();
                result.completeExceptionally(classify(ex, callId));
                return;
            }
            int status = response.statusCode();
            if (!isSuccess(status)) {
                String body = drain(response.body(), callId);
                releaseSlot();
                log.warn("Stream open failed with HTTP error: providerId={}, callId={}, status={}",
                        providerId, callId, status);
                result.completeExceptionally(ProviderException.fromStatus(status, providerId, callId, body));
                return;
            }
            InputStream body = new SlotReleasingInputStream(response.body());
            if (!result.complete(body)) {
                // caller already gave up on this call
                closeQuietly(body, callId);
            }
        });
        bindTimeout(result, exchange, callId, timeout);
        return result;
    }

    /**
     * Sends a lightweight probe and completes with the HTTP status, whatever it is.
     * Probes bypass the concurrency limit so a saturated provider can still be checked.
     */
    public CompletableFuture<Integer> probe(String callId, HttpRequest request, Duration timeout) {
        CompletableFuture<HttpResponse<Void>> exchange;
        try {
            exchange = httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(classify(e, callId));
        }

        CompletableFuture<Integer> result = new CompletableFuture<>();
        exchange.whenComplete((response, ex) -> {
            if (ex != null) {
                result.completeExceptionally(classify(ex, callId));
            } else {
                result.complete(response.statusCode());
            }
        });
        bindTimeout(result, exchange, callId, timeout);
        return result;
    }

    /**
     * Maps a call's result while keeping cancellation linked: when the mapped future
     * completes exceptionally (timer, caller cancel) the upstream call is cancelled too.
     */
    public static <A, B> CompletableFuture<B> mapLinked(
            CompletableFuture<A> upstream,
            Function<? super A, ? extends B> mapper
    ) {
        CompletableFuture<B> downstream = upstream.thenApply(mapper);
        downstream.whenComplete((value, ex) -> {
            if (ex != null && !upstream.isDone()) {
                upstream.cancel(true);
            }
        });
        return downstream;
    }

    /**
     * Converts any failure of a call into a classified {@link ProviderException}.
     */
    public ProviderException classify(Throwable ex, String callId) {
        Throwable cause = unwrap(ex);
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return new ProviderException(ErrorKind.TIMEOUT, 0, providerId, callId,
                    "Call timed out: " + cause.getMessage(), cause);
        }
        if (cause instanceof CancellationException) {
            return new ProviderException(ErrorKind.UNKNOWN, 0, providerId, callId, "Call cancelled", cause);
        }
        if (cause instanceof IOException) {
            log.warn("Provider connection error: providerId={}, callId={}, errorType={}, error={}",
                    providerId, callId, cause.getClass().getSimpleName(), cause.getMessage());
            return new ProviderException(ErrorKind.UPSTREAM_5XX, 0, providerId, callId,
                    "Connection error: " + cause.getMessage(), cause);
        }
        log.error("Provider call failed unexpectedly: providerId={}, callId={}, errorType={}",
                providerId, callId, cause.getClass().getSimpleName(), cause);
        return new ProviderException(ErrorKind.UNKNOWN, 0, providerId, callId,
                "Unexpected failure: " + cause.getMessage(), cause);
    }

    public static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void bindTimeout(
            CompletableFuture<?> result,
            CompletableFuture<?> exchange,
            String callId,
            Duration timeout
    ) {
        ScheduledFuture<?> timeoutTask = timer.schedule(() -> {
            boolean expired = result.completeExceptionally(new ProviderException(
                    ErrorKind.TIMEOUT, 0, providerId, callId, "No response within " + timeout.toMillis() + "ms"));
            if (expired) {
                log.warn("Request timeout: providerId={}, callId={}, timeoutMs={}",
                        providerId, callId, timeout.toMillis());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        result.whenComplete((value, ex) -> {
            timeoutTask.cancel(false);
            if (!exchange.isDone()) {
                exchange.cancel(true);
                log.debug("In-flight exchange cancelled: providerId={}, callId={}", providerId, callId);
            }
        });
    }

    private boolean tryAcquireSlot() {
        while (true) {
            int current = inFlightRequests.get();
            if (current >= maxConcurrentRequests) {
                return false;
            }
            if (inFlightRequests.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void releaseSlot() {
        inFlightRequests.decrementAndGet();
    }

    private ProviderException saturated(String callId) {
        log.warn("Outbound concurrency limit reached: providerId={}, callId={}, maxConcurrentRequests={}",
                providerId, callId, maxConcurrentRequests);
        return new ProviderException(ErrorKind.RATE_LIMITED, 0, providerId, callId,
                "Outbound concurrency limit reached (" + maxConcurrentRequests + ")");
    }

    private String drain(InputStream body, String callId) {
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Could not read error body: providerId={}, callId={}, error={}",
                    providerId, callId, e.getMessage());
            return "";
        }
    }

    private void closeQuietly(InputStream stream, String callId) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Error closing abandoned stream: providerId={}, callId={}", providerId, callId, e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    public String getProviderId() {
        return providerId;
    }

    public int getInFlightRequests() {
        return inFlightRequests.get();
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }

    /**
     * Response body that gives the concurrency slot back exactly once when closed.
     */
    private final class SlotReleasingInputStream extends FilterInputStream {
        private final AtomicBoolean released = new AtomicBoolean(false);

        SlotReleasingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                if (released.compareAndSet(false, true)) {
                    releaseSlot();
                }
            }
        }
    }
}
