package fr.lapetina.airouter;

import fr.lapetina.airouter.domain.exception.RoutingException;
import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.CanonicalResponse;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.config.ConfigLoader;
import fr.lapetina.airouter.infrastructure.config.RouterConfig;
import fr.lapetina.airouter.provider.ProviderEndpoint;
import fr.lapetina.airouter.provider.ProviderType;
import fr.lapetina.airouter.routing.FailoverRouter;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.support.StubProviderAdapter;
import io.micrometer.core.instrument.Counter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingEngineFactoryTest {

    private StubProviderAdapter primary;
    private StubProviderAdapter secondary;
    private RoutingEngineFactory engine;

    @BeforeEach
    void setUp() {
        primary = new StubProviderAdapter("primary");
        secondary = new StubProviderAdapter("secondary");
        engine = new TestRoutingEngineFactory("test-config.yaml",
                Map.of("primary", primary, "secondary", secondary)).start();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static CanonicalRequest request(String model) {
        return CanonicalRequest.builder()
                .model(model)
                .message(CanonicalRequest.Message.user("Summarize the incident report"))
                .build();
    }

    /**
     * Metrics are fed by the event consumers, so wait for the counter to show up.
     */
    private double awaitCount(String name, String... tags) throws InterruptedException {
        return awaitCount(1, name, tags);
    }

    private double awaitCount(double atLeast, String name, String... tags) throws InterruptedException {
        long waitUntil = System.currentTimeMillis() + 5000;
        double seen = 0;
        while (System.currentTimeMillis() < waitUntil) {
            Counter counter = engine.getMetricsRegistry().getRegistry().find(name).tags(tags).counter();
            seen = counter != null ? counter.count() : 0;
            if (seen >= atLeast) {
                return seen;
            }
            Thread.sleep(20);
        }
        return seen;
    }

    @Nested
    @DisplayName("wiring")
    class Wiring {

        @Test
        @DisplayName("should register only enabled providers")
        void shouldSkipDisabledProviders() {
            assertThat(engine.getAdapters()).containsOnlyKeys("primary", "secondary");
            assertThat(engine.getConfig().getMetrics().getPrefix()).isEqualTo("test_router");
            assertThat(engine.getRouter().getAttemptTimeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(engine.getRouter().getOverallDeadline()).isEqualTo(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("should reject an alias whose providers are all disabled")
        void shouldRejectDisabledAlias() {
            assertThatThrownBy(() -> engine.getRouter().route(request("spare-model")))
                    .isInstanceOf(RoutingException.class)
                    .hasMessageContaining("No enabled provider");
        }

        @Test
        @DisplayName("should map provider configuration to an endpoint")
        void shouldMapEndpoint() {
            RouterConfig.ProviderConfig provider = engine.getConfig().getProviders().get(0);

            ProviderEndpoint endpoint = RoutingEngineFactory.toEndpoint(provider);

            assertThat(endpoint.id()).isEqualTo("primary");
            assertThat(endpoint.type()).isEqualTo(ProviderType.OPENAI);
            assertThat(endpoint.baseUrl()).hasToString("http://localhost:1");
            assertThat(endpoint.apiKey()).isEqualTo("test-key");
            assertThat(endpoint.maxConcurrentRequests()).isEqualTo(4);
            assertThat(endpoint.timeout()).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("should fail for a missing configuration file")
        void shouldFailForMissingConfig() {
            assertThatThrownBy(() -> RoutingEngineFactory.create("missing-config.yaml"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("should route an alias to its first candidate and price the call")
        void shouldRouteAndPrice() throws Exception {
            CanonicalResponse response = engine.getRouter().route(request("fast-model"));

            assertThat(response.provider()).isEqualTo("primary");
            assertThat(response.model()).isEqualTo("fast-1");
            assertThat(response.cost()).isEqualByComparingTo("0.00002");
            assertThat(primary.getReceivedRequests()).extracting(CanonicalRequest::model).containsExactly("fast-1");
            assertThat(awaitCount("test_router_requests_total", "model", "fast-model", "status", "success"))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail over to the secondary provider and count it")
        void shouldFailOver() throws Exception {
            primary.thenFail(ErrorKind.UPSTREAM_5XX);

            CanonicalResponse response = engine.getRouter().route(request("fast-model"));

            assertThat(response.provider()).isEqualTo("secondary");
            assertThat(response.metadata().fallbackUsed()).isTrue();
            assertThat(response.metadata().attemptedProviders()).containsExactly("primary", "secondary");
            assertThat(awaitCount("test_router_failovers_total", "from", "primary", "to", "secondary"))
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should stream from the selected provider")
        void shouldStream() {
            primary.thenStream(List.of("Hel", "lo"), Usage.of(12, 2));
            List<String> text = new ArrayList<>();

            try (CompletionStream stream = engine.getRouter().routeStream(request("fast-model").withStream(true))) {
                stream.forEachRemaining(chunk -> text.add(chunk.text()));
                assertThat(stream.summary().usage()).isEqualTo(Usage.of(12, 2));
                assertThat(stream.summary().failed()).isFalse();
            }

            assertThat(String.join("", text)).isEqualTo("Hello");
        }

        @Test
        @DisplayName("should count rejected model names under a single meter")
        void shouldBoundRejectedModelTags() throws Exception {
            for (int i = 0; i < 5; i++) {
                CanonicalRequest unknown = request("made-up-model-" + i);
                assertThatThrownBy(() -> engine.getRouter().route(unknown)).isInstanceOf(RoutingException.class);
            }

            assertThat(awaitCount(5, "test_router_requests_total",
                    "model", FailoverRouter.UNRESOLVED_MODEL, "status", "invalid_request")).isEqualTo(5.0);
            assertThat(engine.getMetricsRegistry().getRegistry().find("test_router_requests_total").counters())
                    .hasSize(1);
            assertThat(engine.getMetricsRegistry().getRegistry().find("test_router_request_latency").timers())
                    .hasSize(1);
        }

        @Test
        @DisplayName("should expose the routing series in the Prometheus scrape")
        void shouldExposeScrape() throws Exception {
            engine.getRouter().route(request("fast-model"));
            awaitCount("test_router_requests_total", "model", "fast-model", "status", "success");

            assertThat(engine.getMetricsRegistry().scrape())
                    .contains("test_router_requests_total")
                    .contains("test_router_attempts_total")
                    .contains("test_router_provider_health{");
        }
    }

    @Test
    @DisplayName("should close every adapter on shutdown")
    void shouldCloseAdapters() {
        engine.close();

        assertThat(primary.isClosed()).isTrue();
        assertThat(secondary.isClosed()).isTrue();
    }
}
