package fr.lapetina.airouter.support;

import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.CanonicalResponse;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.domain.model.ResponseMetadata;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.provider.ProviderAdapter;
import fr.lapetina.airouter.streaming.CompletionStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scriptable in-memory adapter. Queued behaviors are consumed one per call; once the queue
 * is empty the default behavior answers.
 */
public class StubProviderAdapter implements ProviderAdapter {

    private final String id;
    private final Deque<Function<CanonicalRequest, CompletableFuture<CanonicalResponse>>> behaviors = new ArrayDeque<>();
    private final Deque<Function<CanonicalRequest, CompletableFuture<CompletionStream>>> streamBehaviors = new ArrayDeque<>();
    private final List<CanonicalRequest> received = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<?>> hangingCalls = new CopyOnWriteArrayList<>();
    private final AtomicInteger probes = new AtomicInteger();
    private volatile Function<CanonicalRequest, CompletableFuture<CanonicalResponse>> defaultBehavior;
    private volatile Supplier<CompletableFuture<ProviderHealth>> health;
    private volatile boolean closed;

    public StubProviderAdapter(String id) {
        this.id = id;
        this.defaultBehavior = request -> CompletableFuture.completedFuture(response(request, "ok", Usage.of(10, 5)));
        this.health = () -> CompletableFuture.completedFuture(ProviderHealth.healthy(id, 1));
    }

    // ---- scripting ----

    public StubProviderAdapter thenAnswer(String content) {
        return thenAnswer(content, Usage.of(10, 5));
    }

    public synchronized StubProviderAdapter thenAnswer(String content, Usage usage) {
        behaviors.add(request -> CompletableFuture.completedFuture(response(request, content, usage)));
        return this;
    }

    public synchronized StubProviderAdapter thenFail(ErrorKind kind) {
        behaviors.add(request -> CompletableFuture.failedFuture(failure(kind)));
        return this;
    }

    /**
     * Next call never completes on its own.
     */
    public synchronized StubProviderAdapter thenHang() {
        behaviors.add(request -> {
            CompletableFuture<CanonicalResponse> call = new CompletableFuture<>();
            hangingCalls.add(call);
            return call;
        });
        return this;
    }

    public StubProviderAdapter alwaysAnswer(String content) {
        this.defaultBehavior = request -> CompletableFuture.completedFuture(response(request, content, Usage.of(10, 5)));
        return this;
    }

    public StubProviderAdapter alwaysFail(ErrorKind kind) {
        this.defaultBehavior = request -> CompletableFuture.failedFuture(failure(kind));
        return this;
    }

    public synchronized StubProviderAdapter thenStream(List<String> chunks, Usage usage) {
        streamBehaviors.add(request -> CompletableFuture.completedFuture(
                new ScriptedStream(id, request, chunks, usage, false)));
        return this;
    }

    /**
     * Next stream delivers the chunks, then breaks instead of ending normally.
     */
    public synchronized StubProviderAdapter thenStreamBreaking(List<String> chunks) {
        streamBehaviors.add(request -> CompletableFuture.completedFuture(
                new ScriptedStream(id, request, chunks, Usage.EMPTY, true)));
        return this;
    }

    public synchronized StubProviderAdapter thenStreamFail(ErrorKind kind) {
        streamBehaviors.add(request -> CompletableFuture.failedFuture(failure(kind)));
        return this;
    }

    public StubProviderAdapter health(Supplier<CompletableFuture<ProviderHealth>> health) {
        this.health = health;
        return this;
    }

    // ---- ProviderAdapter ----

    @Override
    public String id() {
        return id;
    }

    @Override
    public CompletableFuture<CanonicalResponse> process(CanonicalRequest request) {
        received.add(request);
        Function<CanonicalRequest, CompletableFuture<CanonicalResponse>> behavior;
        synchronized (this) {
            behavior = behaviors.isEmpty() ? defaultBehavior : behaviors.poll();
        }
        return behavior.apply(request);
    }

    @Override
    public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
        received.add(request);
        Function<CanonicalRequest, CompletableFuture<CompletionStream>> behavior;
        synchronized (this) {
            behavior = streamBehaviors.poll();
        }
        if (behavior == null) {
            return CompletableFuture.completedFuture(
                    new ScriptedStream(id, request, List.of("ok"), Usage.of(10, 1), false));
        }
        return behavior.apply(request);
    }

    @Override
    public CompletableFuture<ProviderHealth> healthCheck() {
        probes.incrementAndGet();
        return health.get();
    }

    @Override
    public void close() {
        closed = true;
    }

    // ---- inspection ----

    public int getCallCount() {
        return received.size();
    }

    public List<CanonicalRequest> getReceivedRequests() {
        return Collections.unmodifiableList(new ArrayList<>(received));
    }

    public List<CompletableFuture<?>> getHangingCalls() {
        return hangingCalls;
    }

    public int getProbeCount() {
        return probes.get();
    }

    public boolean isClosed() {
        return closed;
    }

    private ProviderException failure(ErrorKind kind) {
        int status = switch (kind) {
            case AUTH -> 401;
            case RATE_LIMITED -> 429;
            case UPSTREAM_5XX -> 503;
            case BAD_REQUEST -> 400;
            default -> 0;
        };
        return new ProviderException(kind, status, id, "stub-call", "stub failure: " + kind.wireName());
    }

    private CanonicalResponse response(CanonicalRequest request, String content, Usage usage) {
        return CanonicalResponse.builder()
                .id("resp-" + id)
                .provider(id)
                .model(request.model())
                .content(content)
                .usage(usage)
                .finishReason(FinishReason.STOP)
                .responseTimeMs(1)
                .metadata(ResponseMetadata.forCall(request.id(), id + "_call", id, false))
                .build();
    }
}
