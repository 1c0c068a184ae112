package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.cost.CostCalculator;
import fr.lapetina.airouter.cost.PriceTable;
import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.CanonicalResponse;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.config.RouterConfig;
import fr.lapetina.airouter.infrastructure.health.HealthMonitor;
import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.provider.ProviderAdapter;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.streaming.StreamChunk;
import fr.lapetina.airouter.streaming.StreamSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes canonical requests across an ordered list of provider candidates.
 *
 * <p>Candidates are tried strictly one after another, never concurrently. Each attempt runs
 * under {@code min(attemptTimeout, remaining deadline)}; when that budget expires the attempt
 * is completed as a timeout and the in-flight exchange is cancelled. Request-shape failures
 * (auth, bad request) stop routing; every other failure moves on to the next candidate until
 * the list or the overall deadline is exhausted.
 *
 * <p>Thread-safe. A single instance serves all requests.
 */
public final class FailoverRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FailoverRouter.class);

    /**
     * Model reported in failure events for requests rejected before their model resolved.
     */
    public static final String UNRESOLVED_MODEL = "unresolved";

    private final Map<String, ProviderAdapter> adapters;
    private final HealthMonitor healthMonitor;
    private final CandidateResolver resolver;
    private final RequestValidator validator;
    private final BudgetGuard budgetGuard;
    private final CostCalculator costCalculator;
    private final RoutingEventSink events;
    private final Duration attemptTimeout;
    private final Duration overallDeadline;
    private final ScheduledExecutorService timer;

    private FailoverRouter(Builder builder) {
        this.adapters = Map.copyOf(builder.adapters);
        this.healthMonitor = builder.healthMonitor;
        this.resolver = builder.resolver;
        this.validator = builder.validator;
        this.budgetGuard = builder.budgetGuard;
        this.costCalculator = builder.costCalculator;
        this.events = builder.events;
        this.attemptTimeout = builder.attemptTimeout;
        this.overallDeadline = builder.overallDeadline != null
                ? builder.overallDeadline
                : builder.attemptTimeout.multipliedBy(3);
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "router-timer");
            t.setDaemon(true);
            return t;
        });

        log.info("FailoverRouter created: providers={}, attemptTimeout={}, overallDeadline={}",
                adapters.keySet(), attemptTimeout, overallDeadline);
    }

    /**
     * Routes a request and waits for the result.
     * A request with {@code stream=true} is consumed through {@link #routeStream} and aggregated.
     *
     * @throws RoutingException       when no candidate produced a response
     * @throws CancellationException if the calling thread is interrupted
     */
    public CanonicalResponse route(CanonicalRequest request) {
        if (request.stream()) {
            return collect(request);
        }
        CompletableFuture<CanonicalResponse> future = routeAsync(request);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while routing request " + request.id());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Routing failed: requestId=" + request.id(), cause);
        }
    }

    /**
     * Routes a request without blocking. The stream flag is ignored; use {@link #routeStream}.
     * Cancelling the returned future cancels the in-flight provider call.
     */
    public CompletableFuture<CanonicalResponse> routeAsync(CanonicalRequest request) {
        RoutingDeadline deadline = RoutingDeadline.startingNow(overallDeadline);
        List<Candidate> candidates;
        putMdc(request);
        try {
            candidates = prepare(request, false, deadline);
        } catch (RoutingException e) {
            return CompletableFuture.failedFuture(e);
        } finally {
            clearMdc();
        }

        RoutingPass pass = new RoutingPass(request.withStream(false), candidates, deadline);
        pass.dispatchNext();
        return pass.result;
    }

    /**
     * Opens a stream on the first candidate that accepts the call.
     * Candidates failing before their first content chunk are failed over; afterwards a
     * failure surfaces as a terminal {@link fr.lapetina.airouter.domain.exception.StreamException}.
     *
     * @throws RoutingException when no candidate could open a stream
     */
    public CompletionStream routeStream(CanonicalRequest request) {
        RoutingDeadline deadline = RoutingDeadline.startingNow(overallDeadline);
        putMdc(request);
        try {
            List<Candidate> candidates = prepare(request, true, deadline);
            FailoverCompletionStream stream = new FailoverCompletionStream(this, request.withStream(true),
                    candidates, deadline);
            stream.open();
            return stream;
        } finally {
            clearMdc();
        }
    }

    private List<Candidate> prepare(CanonicalRequest request, boolean streaming, RoutingDeadline deadline) {
        events.requestStarted(request.id(), request.model(), streaming);
        List<Candidate> resolved;
        try {
            validator.validate(request);
            resolved = resolver.resolve(request);
        } catch (RoutingException e) {
            // caller-supplied names that resolve to nothing must not become metric tags
            requestFailed(request, UNRESOLVED_MODEL, e, deadline);
            throw e;
        }
        try {
            List<Candidate> candidates = CandidateResolver.orderByHealth(
                    resolved, providerId -> healthMonitor.getHealthTable().statusOf(providerId));
            budgetGuard.check(request, candidates);
            log.info("Routing request: requestId={}, model={}, streaming={}, candidates={}",
                    request.id(), request.model(), streaming, candidates);
            return candidates;
        } catch (RoutingException e) {
            requestFailed(request, e, deadline);
            throw e;
        }
    }

    private CanonicalResponse collect(CanonicalRequest request) {
        StringBuilder content = new StringBuilder();
        long start = System.nanoTime();
        try (CompletionStream stream = routeStream(request)) {
            while (stream.hasNext()) {
                StreamChunk chunk = stream.next();
                content.append(chunk.text());
            }
            StreamSummary summary = stream.summary();
            return CanonicalResponse.builder()
                    .id(summary.metadata().callId())
                    .provider(summary.provider())
                    .model(summary.model())
                    .content(content.toString())
                    .usage(summary.usage())
                    .finishReason(summary.finishReason())
                    .responseTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                    .cost(summary.cost())
                    .metadata(summary.metadata())
                    .build();
        }
    }

    // Shared with FailoverCompletionStream

    CompletableFuture<CompletionStream> openCandidate(Candidate candidate, CanonicalRequest request) {
        ProviderAdapter adapter = adapters.get(candidate.providerId());
        if (adapter == null) {
            return CompletableFuture.failedFuture(noAdapter(candidate));
        }
        try {
            return adapter.openStream(request.withModel(candidate.model()));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Records a failed attempt in logs, events and the health table.
     */
    void attemptFailed(CanonicalRequest request, Candidate candidate, Instant startedAt, long startNanos,
                       ErrorKind kind, String detail) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.warn("Attempt failed: requestId={}, providerId={}, model={}, kind={}, durationMs={}, error={}",
                request.id(), candidate.providerId(), candidate.model(), kind.wireName(), durationMs, detail);
        events.attemptFinished(request.id(), request.model(),
                RoutingAttempt.failure(candidate.providerId(), startedAt, kind, durationMs));
        healthMonitor.reportCallFailure(candidate.providerId(), kind);
    }

    void attemptSucceeded(CanonicalRequest request, Candidate candidate, Instant startedAt, long startNanos) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        events.attemptFinished(request.id(), request.model(),
                RoutingAttempt.success(candidate.providerId(), startedAt, durationMs));
    }

    void failingOver(CanonicalRequest request, Candidate from, Candidate to, ErrorKind cause) {
        log.info("Failing over: requestId={}, from={}, to={}, cause={}",
                request.id(), from.providerId(), to.providerId(), cause.wireName());
        events.failover(request.id(), from.providerId(), to.providerId(), cause);
    }

    void requestSucceeded(CanonicalRequest request, String providerId, String model, Usage usage,
                          BigDecimal cost, int attempts, RoutingDeadline deadline) {
        long elapsedMs = deadline.elapsedMs();
        log.info("Request completed: requestId={}, providerId={}, model={}, attempts={}, totalTokens={}, cost={}, elapsedMs={}",
                request.id(), providerId, model, attempts, usage.totalTokens(),
                cost != null ? cost.toPlainString() : "unavailable", elapsedMs);
        events.requestSucceeded(request.id(), providerId, model, usage, cost, attempts, elapsedMs);
    }

    void requestFailed(CanonicalRequest request, RoutingException error, RoutingDeadline deadline) {
        requestFailed(request, request.model(), error, deadline);
    }

    private void requestFailed(CanonicalRequest request, String reportedModel, RoutingException error,
                               RoutingDeadline deadline) {
        log.warn("Request failed: requestId={}, model={}, kind={}, deadlineExceeded={}, reason={}",
                request.id(), request.model(), error.getKind(), error.isDeadlineExceeded(), error.getMessage());
        events.requestFailed(request.id(), reportedModel, error, deadline.elapsedMs());
    }

    BigDecimal costOf(Usage usage, Candidate candidate, String reportedModel) {
        return costCalculator.costIfPriced(usage, candidate.providerId(), candidate.model(), reportedModel)
                .orElse(null);
    }

    ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return timer.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    Duration attemptTimeout() {
        return attemptTimeout;
    }

    static ErrorKind classify(Throwable ex) {
        Throwable cause = ProviderHttpClient.unwrap(ex);
        return cause instanceof ProviderException provider ? provider.getKind() : ErrorKind.UNKNOWN;
    }

    static void putMdc(CanonicalRequest request) {
        MDC.put("requestId", request.id());
        MDC.put("model", request.model());
    }

    static void clearMdc() {
        MDC.remove("requestId");
        MDC.remove("model");
    }

    private static ProviderException noAdapter(Candidate candidate) {
        return new ProviderException(ErrorKind.UNKNOWN, 0, candidate.providerId(), null,
                "No adapter registered for provider: " + candidate.providerId());
    }

    public Duration getOverallDeadline() {
        return overallDeadline;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    @Override
    public void close() {
        timer.shutdownNow();
        log.info("FailoverRouter stopped");
    }

    /**
     * State of one non-streaming routing pass. Attempts complete one at a time, each
     * callback dispatching the next, so fields are never written concurrently.
     */
    private final class RoutingPass {

        private final CanonicalRequest request;
        private final List<Candidate> candidates;
        private final RoutingDeadline deadline;
        private final CompletableFuture<CanonicalResponse> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<CanonicalResponse>> inFlight = new AtomicReference<>();
        private final List<String> attempted = new ArrayList<>();
        private final List<RoutingException.AttemptFailure> failures = new ArrayList<>();
        private int index;
        private RoutingState state = RoutingState.INIT;

        private RoutingPass(CanonicalRequest request, List<Candidate> candidates, RoutingDeadline deadline) {
            this.request = request;
            this.candidates = candidates;
            this.deadline = deadline;
            result.whenComplete((response, ex) -> {
                if (result.isCancelled()) {
                    CompletableFuture<CanonicalResponse> call = inFlight.get();
                    if (call != null) {
                        call.cancel(true);
                    }
                    log.info("Request cancelled by caller: requestId={}, state={}", request.id(), state);
                }
            });
        }

        private void dispatchNext() {
            if (result.isDone()) {
                return;
            }
            if (deadline.isExpired()) {
                fail(RoutingException.Kind.ALL_PROVIDERS_FAILED, "Overall deadline exceeded", true);
                return;
            }

            Candidate candidate = candidates.get(index);
            Duration budget = deadline.attemptBudget(attemptTimeout);
            boolean cutByDeadline = budget.compareTo(attemptTimeout) < 0;
            Instant startedAt = Instant.now();
            long startNanos = System.nanoTime();

            state = RoutingState.DISPATCHED;
            attempted.add(candidate.providerId());
            log.debug("Dispatching attempt: requestId={}, providerId={}, model={}, attempt={}, budgetMs={}",
                    request.id(), candidate.providerId(), candidate.model(), index + 1, budget.toMillis());

            CompletableFuture<CanonicalResponse> call = bounded(process(candidate), candidate, budget);
            inFlight.set(call);
            if (result.isCancelled()) {
                call.cancel(true);
                return;
            }
            call.whenComplete((response, ex) -> {
                putMdc(request);
                try {
                    if (ex == null) {
                        succeed(candidate, response, startedAt, startNanos);
                    } else {
                        failed(candidate, ex, startedAt, startNanos, cutByDeadline);
                    }
                } finally {
                    clearMdc();
                }
            });
        }

        private CompletableFuture<CanonicalResponse> process(Candidate candidate) {
            ProviderAdapter adapter = adapters.get(candidate.providerId());
            if (adapter == null) {
                return CompletableFuture.failedFuture(noAdapter(candidate));
            }
            try {
                return adapter.process(request.withModel(candidate.model()));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        /**
         * Completes exceptionally with TIMEOUT when the budget runs out first, then cancels the call.
         */
        private CompletableFuture<CanonicalResponse> bounded(
                CompletableFuture<CanonicalResponse> call,
                Candidate candidate,
                Duration budget
        ) {
            CompletableFuture<CanonicalResponse> attempt = new CompletableFuture<>();
            ScheduledFuture<?> timeoutTask = schedule(() -> attempt.completeExceptionally(
                    new ProviderException(ErrorKind.TIMEOUT, 0, candidate.providerId(), null,
                            "Attempt timed out after " + budget.toMillis() + "ms")), budget);
            call.whenComplete((response, ex) -> {
                timeoutTask.cancel(false);
                if (ex == null) {
                    attempt.complete(response);
                } else {
                    attempt.completeExceptionally(ProviderHttpClient.unwrap(ex));
                }
            });
            attempt.whenComplete((response, ex) -> {
                if (!call.isDone()) {
                    call.cancel(true);
                }
            });
            return attempt;
        }

        private void succeed(Candidate candidate, CanonicalResponse response, Instant startedAt, long startNanos) {
            if (result.isDone()) {
                return;
            }
            state = RoutingState.SUCCESS;
            attemptSucceeded(request, candidate, startedAt, startNanos);
            BigDecimal cost = costOf(response.usage(), candidate, response.model());
            CanonicalResponse stamped = response.withRouting(attempted, cost);
            requestSucceeded(request, candidate.providerId(), stamped.model(), stamped.usage(),
                    cost, attempted.size(), deadline);
            result.complete(stamped);
        }

        private void failed(Candidate candidate, Throwable ex, Instant startedAt, long startNanos,
                            boolean cutByDeadline) {
            Throwable cause = ProviderHttpClient.unwrap(ex);
            if (result.isCancelled()) {
                log.debug("Attempt ended after cancellation: requestId={}, providerId={}",
                        request.id(), candidate.providerId());
                return;
            }
            ErrorKind kind = classify(cause);
            failures.add(new RoutingException.AttemptFailure(candidate.providerId(), kind));
            attemptFailed(request, candidate, startedAt, startNanos, kind, cause.getMessage());

            if (!kind.isFailoverEligible()) {
                fail(RoutingException.Kind.INVALID_REQUEST,
                        "Request rejected by " + candidate.providerId(), false);
                return;
            }

            boolean deadlineHit = deadline.isExpired() || (cutByDeadline && kind == ErrorKind.TIMEOUT);
            index++;
            if (index >= candidates.size() || deadlineHit) {
                fail(RoutingException.Kind.ALL_PROVIDERS_FAILED,
                        deadlineHit ? "Overall deadline exceeded" : "All providers failed", deadlineHit);
                return;
            }

            state = RoutingState.RETRY_NEXT;
            failingOver(request, candidate, candidates.get(index), kind);
            dispatchNext();
        }

        private void fail(RoutingException.Kind kind, String message, boolean deadlineExceeded) {
            state = RoutingState.TERMINAL_FAILURE;
            RoutingException error = new RoutingException(kind, request.id(), message, failures, deadlineExceeded);
            requestFailed(request, error, deadline);
            result.completeExceptionally(error);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FailoverRouter.
     */
    public static final class Builder {
        private Map<String, ProviderAdapter> adapters;
        private HealthMonitor healthMonitor;
        private CandidateResolver resolver;
        private RequestValidator validator = RequestValidator.withDefaults();
        private BudgetGuard budgetGuard = BudgetGuard.disabled();
        private CostCalculator costCalculator = new CostCalculator(PriceTable.empty());
        private RoutingEventSink events = RoutingEventSink.NOOP;
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration overallDeadline;

        public Builder adapters(Map<String, ProviderAdapter> adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder healthMonitor(HealthMonitor healthMonitor) {
            this.healthMonitor = healthMonitor;
            return this;
        }

        public Builder resolver(CandidateResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder budgetGuard(BudgetGuard budgetGuard) {
            this.budgetGuard = budgetGuard;
            return this;
        }

        public Builder costCalculator(CostCalculator costCalculator) {
            this.costCalculator = costCalculator;
            return this;
        }

        public Builder eventSink(RoutingEventSink events) {
            this.events = events;
            return this;
        }

        public Builder attemptTimeout(Duration timeout) {
            this.attemptTimeout = timeout;
            return this;
        }

        /**
         * Defaults to three times the attempt timeout.
         */
        public Builder overallDeadline(Duration deadline) {
            this.overallDeadline = deadline;
            return this;
        }

        public Builder fromConfig(RouterConfig config) {
            PriceTable prices = PriceTable.fromConfig(config.getPricing());
            Double maxCost = config.getRouting().getMaxRequestCost();
            this.resolver = CandidateResolver.fromConfig(config);
            this.validator = new RequestValidator(config.getValidation().getAllowedModels(),
                    config.getValidation().getMaxContentLength());
            this.costCalculator = new CostCalculator(prices);
            this.budgetGuard = new BudgetGuard(prices, maxCost != null ? BigDecimal.valueOf(maxCost) : null);
            this.attemptTimeout = Duration.ofMillis(config.getRouting().getAttemptTimeoutMs());
            this.overallDeadline = Duration.ofMillis(config.getRouting().effectiveOverallDeadlineMs());
            return this;
        }

        public FailoverRouter build() {
            if (adapters == null || adapters.isEmpty()) {
                throw new IllegalStateException("At least one ProviderAdapter is required");
            }
            if (healthMonitor == null) {
                throw new IllegalStateException("HealthMonitor is required");
            }
            if (resolver == null) {
                throw new IllegalStateException("CandidateResolver is required");
            }
            return new FailoverRouter(this);
        }
    }
}
