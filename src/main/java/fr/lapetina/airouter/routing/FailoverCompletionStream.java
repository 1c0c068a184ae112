package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.exception.StreamException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.streaming.StreamChunk;
import fr.lapetina.airouter.streaming.StreamSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completion stream that fails over between candidates until the first chunk reaches the
 * caller. From then on the provider is committed: a broken stream raises a terminal
 * {@link StreamException} and its failed summary stays available.
 *
 * <p>Each attempt stays under its per-attempt budget until its first chunk: a stream that opens
 * and then stalls is closed by the attempt timer and failed over as a timeout. The overall
 * deadline closes whichever stream is active when it expires.
 */
final class FailoverCompletionStream implements CompletionStream {

    private static final Logger log = LoggerFactory.getLogger(FailoverCompletionStream.class);

    private final FailoverRouter router;
    private final CanonicalRequest request;
    private final List<Candidate> candidates;
    private final RoutingDeadline deadline;
    private final List<String> attempted = new ArrayList<>();
    private final List<RoutingException.AttemptFailure> failures = new ArrayList<>();

    private int index;
    private Candidate candidate;
    private Instant attemptStartedAt;
    private long attemptStartNanos;
    private volatile CompletionStream current;
    private ScheduledFuture<?> deadlineTask;
    private ScheduledFuture<?> attemptTask;
    private final AtomicBoolean attemptArmed = new AtomicBoolean(false);
    private volatile int attemptGeneration;
    private volatile boolean attemptTimedOut;
    private boolean committed;
    private StreamSummary summary;
    private boolean delivered;
    private volatile boolean closed;
    private volatile boolean deadlineFired;

    FailoverCompletionStream(
            FailoverRouter router,
            CanonicalRequest request,
            List<Candidate> candidates,
            RoutingDeadline deadline
    ) {
        this.router = router;
        this.request = request;
        this.candidates = candidates;
        this.deadline = deadline;
    }

    /**
     * Opens the first candidate that accepts the call.
     *
     * @throws RoutingException when none does
     */
    void open() {
        deadlineTask = router.schedule(this::onDeadline, deadline.remaining());
        try {
            openNextCandidate();
        } catch (RuntimeException e) {
            deadlineTask.cancel(false);
            throw e;
        }
    }

    @Override
    public boolean hasNext() {
        while (summary == null) {
            if (current.hasNext()) {
                if (committed || attemptArmed.compareAndSet(true, false)) {
                    committed = true;
                    cancelAttemptTimer();
                    return true;
                }
                // the attempt timer won: nothing buffered here was shown to the caller
                discardUndelivered();
            }
            StreamSummary inner = current.summary();
            if (!inner.failed() && !attemptTimedOut) {
                complete(inner);
                return false;
            }
            if (closed) {
                log.info("Stream closed by caller: requestId={}, providerId={}", request.id(), candidate.providerId());
                complete(inner);
                return false;
            }

            ErrorKind kind = deadlineFired || attemptTimedOut ? ErrorKind.TIMEOUT : ErrorKind.UPSTREAM_5XX;
            String detail = attemptTimedOut ? "no content within the attempt budget" : inner.failureDetail();
            failures.add(new RoutingException.AttemptFailure(candidate.providerId(), kind));
            router.attemptFailed(request, candidate, attemptStartedAt, attemptStartNanos, kind, detail);

            if (delivered) {
                complete(inner);
                throw new StreamException(StreamException.Kind.TERMINAL, candidate.providerId(),
                        "Stream failed after content was delivered: " + inner.failureDetail());
            }

            index++;
            try {
                openNextCandidate();
            } catch (RoutingException e) {
                complete(inner);
                throw e;
            }
        }
        return false;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream exhausted");
        }
        StreamChunk chunk = current.next();
        delivered = true;
        return chunk;
    }

    @Override
    public StreamSummary summary() {
        if (summary == null) {
            throw new IllegalStateException("Stream not yet consumed");
        }
        return summary;
    }

    @Override
    public boolean hasDeliveredContent() {
        return delivered;
    }

    @Override
    public void close() {
        closed = true;
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
        }
        cancelAttemptTimer();
        CompletionStream active = current;
        if (active != null) {
            active.close();
        }
    }

    private void openNextCandidate() {
        while (index < candidates.size()) {
            if (deadline.isExpired()) {
                throw exhausted(true);
            }
            Candidate next = candidates.get(index);
            if (candidate != null && next != candidate) {
                router.failingOver(request, candidate, next, failures.get(failures.size() - 1).errorKind());
            }
            candidate = next;
            attempted.add(next.providerId());
            attemptStartedAt = Instant.now();
            attemptStartNanos = System.nanoTime();
            Duration budget = deadline.attemptBudget(router.attemptTimeout());

            try {
                current = awaitOpen(router.openCandidate(next, request), next, budget);
                armAttemptTimer(current, next, budget);
                if (closed) {
                    current.close();
                }
                log.debug("Stream opened: requestId={}, providerId={}, model={}, attempt={}",
                        request.id(), next.providerId(), next.model(), index + 1);
                return;
            } catch (ProviderException e) {
                ErrorKind kind = e.getKind();
                failures.add(new RoutingException.AttemptFailure(next.providerId(), kind));
                router.attemptFailed(request, next, attemptStartedAt, attemptStartNanos, kind, e.getMessage());
                if (!kind.isFailoverEligible()) {
                    throw failure(RoutingException.Kind.INVALID_REQUEST, "Request rejected by " + next.providerId(), false);
                }
                index++;
            }
        }
        throw exhausted(deadline.isExpired());
    }

    private CompletionStream awaitOpen(CompletableFuture<CompletionStream> opening, Candidate target, Duration budget) {
        try {
            return opening.get(budget.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (opening.cancel(true)) {
                throw new ProviderException(ErrorKind.TIMEOUT, 0, target.providerId(), null,
                        "Stream open timed out after " + budget.toMillis() + "ms");
            }
            // completed between the timeout and the cancel
            return awaitOpen(opening, target, Duration.ZERO);
        } catch (ExecutionException e) {
            Throwable cause = ProviderHttpClient.unwrap(e);
            if (cause instanceof ProviderException provider) {
                throw provider;
            }
            throw new ProviderException(FailoverRouter.classify(cause), 0, target.providerId(), null,
                    "Stream open failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            opening.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while opening stream for request " + request.id());
        }
    }

    /**
     * Starts the timer bounding the wait for the first chunk with what is left of the attempt budget.
     */
    private void armAttemptTimer(CompletionStream opened, Candidate target, Duration budget) {
        cancelAttemptTimer();
        attemptTimedOut = false;
        committed = false;
        int generation = ++attemptGeneration;
        Duration left = budget.minusNanos(System.nanoTime() - attemptStartNanos);
        attemptArmed.set(true);
        attemptTask = router.schedule(() -> onAttemptTimeout(generation, opened, target, budget),
                left.isNegative() ? Duration.ZERO : left);
    }

    private void onAttemptTimeout(int generation, CompletionStream opened, Candidate target, Duration budget) {
        if (generation != attemptGeneration || !attemptArmed.compareAndSet(true, false)) {
            return;
        }
        attemptTimedOut = true;
        log.warn("Attempt timed out before first chunk, closing stream: requestId={}, providerId={}, budgetMs={}",
                request.id(), target.providerId(), budget.toMillis());
        opened.close();
    }

    private void cancelAttemptTimer() {
        ScheduledFuture<?> task = attemptTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    private void discardUndelivered() {
        while (current.hasNext()) {
            current.next();
        }
    }

    private void complete(StreamSummary inner) {
        if (deadlineTask != null) {
            deadlineTask.cancel(false);
        }
        cancelAttemptTimer();
        BigDecimal cost = router.costOf(inner.usage(), candidate, inner.model());
        summary = inner.withRouting(attempted, cost);
        if (!inner.failed() && !attemptTimedOut) {
            router.attemptSucceeded(request, candidate, attemptStartedAt, attemptStartNanos);
            router.requestSucceeded(request, candidate.providerId(), summary.model(), summary.usage(),
                    cost, attempted.size(), deadline);
        }
    }

    private void onDeadline() {
        deadlineFired = true;
        CompletionStream active = current;
        if (active != null && summary == null) {
            log.warn("Overall deadline reached, closing stream: requestId={}, providerId={}",
                    request.id(), candidate != null ? candidate.providerId() : "none");
            active.close();
        }
    }

    private RoutingException exhausted(boolean deadlineExceeded) {
        return failure(RoutingException.Kind.ALL_PROVIDERS_FAILED,
                deadlineExceeded ? "Overall deadline exceeded" : "All providers failed", deadlineExceeded);
    }

    private RoutingException failure(RoutingException.Kind kind, String message, boolean deadlineExceeded) {
        RoutingException error = new RoutingException(kind, request.id(), message, failures, deadlineExceeded);
        router.requestFailed(request, error, deadline);
        return error;
    }
}
