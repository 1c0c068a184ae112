package fr.lapetina.airouter.routing;

import fr.lapetina.airouter.cost.CostCalculator;
import fr.lapetina.airouter.cost.PriceTable;
import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.exception.StreamException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.health.HealthMonitor;
import fr.lapetina.airouter.infrastructure.health.ProviderHealthTable;
import fr.lapetina.airouter.provider.ProviderAdapter;
import fr.lapetina.airouter.provider.openai.OpenAiStreamDialect;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.streaming.StreamNormalizer;
import fr.lapetina.airouter.streaming.StreamSummary;
import fr.lapetina.airouter.support.RecordingEventSink;
import fr.lapetina.airouter.support.StallingInputStream;
import fr.lapetina.airouter.support.StubProviderAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class FailoverCompletionStreamTest {

    private StubProviderAdapter p1;
    private StubProviderAdapter p2;
    private HealthMonitor healthMonitor;
    private RecordingEventSink events;
    private FailoverRouter router;

    @BeforeEach
    void setUp() {
        p1 = new StubProviderAdapter("p1");
        p2 = new StubProviderAdapter("p2");
        Map<String, ProviderAdapter> adapters = Map.of("p1", p1, "p2", p2);
        healthMonitor = new HealthMonitor(adapters, new ProviderHealthTable());
        events = new RecordingEventSink();
        router = FailoverRouter.builder()
                .adapters(adapters)
                .healthMonitor(healthMonitor)
                .resolver(new CandidateResolver(
                        Map.of("chat", List.of(new Candidate("p1", "m1"), new Candidate("p2", "m2"))),
                        adapters.keySet()))
                .costCalculator(new CostCalculator(PriceTable.builder()
                        .perMillion("p1", "m1", 1.0, 2.0)
                        .build()))
                .eventSink(events)
                .attemptTimeout(Duration.ofMillis(500))
                .build();
    }

    @AfterEach
    void tearDown() {
        router.close();
        healthMonitor.close();
    }

    private static CanonicalRequest request() {
        return CanonicalRequest.builder()
                .model("chat")
                .message(CanonicalRequest.Message.user("tell me a story"))
                .build();
    }

    private static List<String> drain(CompletionStream stream) {
        List<String> texts = new ArrayList<>();
        while (stream.hasNext()) {
            texts.add(stream.next().text());
        }
        return texts;
    }

    @Test
    @DisplayName("should stream from the first candidate and price the summary")
    void shouldStreamFromFirstCandidate() {
        p1.thenStream(List.of("Once", " upon"), Usage.of(10, 5));

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(drain(stream)).containsExactly("Once", " upon");

            StreamSummary summary = stream.summary();
            assertThat(summary.provider()).isEqualTo("p1");
            assertThat(summary.failed()).isFalse();
            assertThat(summary.cost()).isEqualByComparingTo(new BigDecimal("0.00002"));
            assertThat(summary.metadata().attemptedProviders()).containsExactly("p1");
            assertThat(summary.metadata().fallbackUsed()).isFalse();
        }
        assertThat(events.getEvents()).contains("succeeded:p1:1");
    }

    @Test
    @DisplayName("should fail over when the first candidate refuses to open")
    void shouldFailOverOnOpenFailure() {
        p1.thenStreamFail(ErrorKind.UPSTREAM_5XX);
        p2.thenStream(List.of("Hi"), Usage.of(2, 1));

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(drain(stream)).containsExactly("Hi");
            assertThat(stream.summary().provider()).isEqualTo("p2");
            assertThat(stream.summary().metadata().attemptedProviders()).containsExactly("p1", "p2");
            assertThat(stream.summary().metadata().fallbackUsed()).isTrue();
            assertThat(stream.summary().cost()).isNull();
        }
        assertThat(events.getEvents()).contains("failover:p1->p2:upstream_5xx");
    }

    @Test
    @DisplayName("should fail over when a stream breaks before its first chunk")
    void shouldFailOverOnEarlyBreak() {
        p1.thenStreamBreaking(List.of());
        p2.thenStream(List.of("Hi"), Usage.of(2, 1));

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(drain(stream)).containsExactly("Hi");
            assertThat(stream.summary().provider()).isEqualTo("p2");
        }
    }

    @Test
    @DisplayName("should raise a terminal error when a stream breaks after content")
    void shouldRaiseTerminalErrorAfterContent() {
        p1.thenStreamBreaking(List.of("Once"));

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(stream.next().text()).isEqualTo("Once");
            assertThat(stream.hasDeliveredContent()).isTrue();

            assertThatThrownBy(stream::hasNext)
                    .isInstanceOf(StreamException.class)
                    .satisfies(e -> assertThat(((StreamException) e).getKind()).isEqualTo(StreamException.Kind.TERMINAL));

            assertThat(stream.summary().failed()).isTrue();
            assertThat(stream.summary().provider()).isEqualTo("p1");
        }
        assertThat(p2.getCallCount()).isZero();
    }

    @Test
    @DisplayName("should stop on an auth failure while opening")
    void shouldStopOnAuthFailure() {
        p1.thenStreamFail(ErrorKind.AUTH);

        assertThatThrownBy(() -> router.routeStream(request()))
                .isInstanceOf(RoutingException.class)
                .satisfies(e -> assertThat(((RoutingException) e).getKind())
                        .isEqualTo(RoutingException.Kind.INVALID_REQUEST));
        assertThat(p2.getCallCount()).isZero();
    }

    @Test
    @DisplayName("should fail when no candidate opens")
    void shouldFailWhenNoCandidateOpens() {
        p1.thenStreamFail(ErrorKind.UPSTREAM_5XX);
        p2.thenStreamFail(ErrorKind.RATE_LIMITED);

        assertThatThrownBy(() -> router.routeStream(request()))
                .isInstanceOf(RoutingException.class)
                .satisfies(e -> {
                    RoutingException error = (RoutingException) e;
                    assertThat(error.getKind()).isEqualTo(RoutingException.Kind.ALL_PROVIDERS_FAILED);
                    assertThat(error.getFailures()).hasSize(2);
                });
    }

    @Test
    @DisplayName("should time out a candidate that never opens")
    void shouldTimeOutSlowOpen() {
        p2.thenStream(List.of("late"), Usage.EMPTY);

        CompletableFuture<CompletionStream> never = new CompletableFuture<>();
        StubProviderAdapter slow = new StubProviderAdapter("p1") {
            @Override
            public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
                return never;
            }
        };
        router.close();
        router = FailoverRouter.builder()
                .adapters(Map.of("p1", slow, "p2", p2))
                .healthMonitor(healthMonitor)
                .resolver(new CandidateResolver(
                        Map.of("chat", List.of(new Candidate("p1", "m1"), new Candidate("p2", "m2"))),
                        Set.of("p1", "p2")))
                .attemptTimeout(Duration.ofMillis(200))
                .build();

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(drain(stream)).containsExactly("late");
            assertThat(stream.summary().metadata().attemptedProviders()).containsExactly("p1", "p2");
        }
        assertThat(never).isCancelled();
    }

    @Test
    @DisplayName("should fail over when an opened stream stalls before its first chunk")
    void shouldFailOverStalledStream() {
        p2.thenStream(List.of("late"), Usage.of(3, 1));
        StallingInputStream body = new StallingInputStream();
        StubProviderAdapter stalled = new StubProviderAdapter("p1") {
            @Override
            public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
                return CompletableFuture.completedFuture(new StreamNormalizer(
                        body, new OpenAiStreamDialect(), "p1", request.id(), "p1_call", request.model()));
            }
        };
        router.close();
        router = FailoverRouter.builder()
                .adapters(Map.of("p1", stalled, "p2", p2))
                .healthMonitor(healthMonitor)
                .resolver(new CandidateResolver(
                        Map.of("chat", List.of(new Candidate("p1", "m1"), new Candidate("p2", "m2"))),
                        Set.of("p1", "p2")))
                .eventSink(events)
                .attemptTimeout(Duration.ofMillis(300))
                .overallDeadline(Duration.ofMillis(3000))
                .build();

        long start = System.nanoTime();
        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(drain(stream)).containsExactly("late");
            assertThat(stream.summary().provider()).isEqualTo("p2");
            assertThat(stream.summary().failed()).isFalse();
            assertThat(stream.summary().metadata().attemptedProviders()).containsExactly("p1", "p2");
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isLessThan(2000);
        assertThat(body.isClosed()).isTrue();
        assertThat(events.getAttempts())
                .extracting(RoutingAttempt::providerId, RoutingAttempt::outcome, RoutingAttempt::errorKind)
                .containsExactly(
                        tuple("p1", RoutingAttempt.Outcome.TIMEOUT, ErrorKind.TIMEOUT),
                        tuple("p2", RoutingAttempt.Outcome.SUCCESS, null));
        assertThat(events.getEvents()).contains("failover:p1->p2:timeout");
    }

    @Test
    @DisplayName("should keep streaming past the attempt budget once content has arrived")
    void shouldNotTimeOutAfterFirstChunk() throws Exception {
        router.close();
        router = FailoverRouter.builder()
                .adapters(Map.of("p1", p1, "p2", p2))
                .healthMonitor(healthMonitor)
                .resolver(new CandidateResolver(
                        Map.of("chat", List.of(new Candidate("p1", "m1"), new Candidate("p2", "m2"))),
                        Set.of("p1", "p2")))
                .eventSink(events)
                .attemptTimeout(Duration.ofMillis(200))
                .build();
        p1.thenStream(List.of("slow", " reader"), Usage.of(4, 2));

        try (CompletionStream stream = router.routeStream(request())) {
            assertThat(stream.next().text()).isEqualTo("slow");
            Thread.sleep(400);
            assertThat(drain(stream)).containsExactly(" reader");
            assertThat(stream.summary().failed()).isFalse();
            assertThat(stream.summary().provider()).isEqualTo("p1");
        }
        assertThat(p2.getCallCount()).isZero();
    }

    @Test
    @DisplayName("should refuse the summary before the stream ends")
    void shouldRefuseEarlySummary() {
        p1.thenStream(List.of("a", "b"), Usage.EMPTY);

        try (CompletionStream stream = router.routeStream(request())) {
            stream.next();
            assertThatThrownBy(stream::summary).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("should end without failover when the caller closes early")
    void shouldEndWhenClosedEarly() {
        p1.thenStream(List.of("a", "b", "c"), Usage.EMPTY);

        CompletionStream stream = router.routeStream(request());
        assertThat(stream.next().text()).isEqualTo("a");
        stream.close();

        assertThat(stream.hasNext()).isFalse();
        assertThat(stream.summary().failed()).isTrue();
        assertThat(p2.getCallCount()).isZero();
    }
}
