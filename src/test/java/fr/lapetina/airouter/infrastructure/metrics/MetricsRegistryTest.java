package fr.lapetina.airouter.infrastructure.metrics;

import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.RoutingAttempt;
import fr.lapetina.airouter.domain.model.Usage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test_prefix");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count attempts per provider, outcome and kind")
    void shouldCountAttempts() {
        metrics.recordAttempt("openai", RoutingAttempt.Outcome.ERROR, ErrorKind.RATE_LIMITED, Duration.ofMillis(20));
        metrics.recordAttempt("openai", RoutingAttempt.Outcome.ERROR, ErrorKind.RATE_LIMITED, Duration.ofMillis(30));
        metrics.recordAttempt("anthropic", RoutingAttempt.Outcome.SUCCESS, null, Duration.ofMillis(40));

        assertThat(metrics.getRegistry().get("test_prefix_attempts_total")
                .tags("provider", "openai", "kind", "rate_limited").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("test_prefix_attempts_total")
                .tags("provider", "anthropic", "outcome", "success", "kind", "none").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_prefix_attempt_latency")
                .tag("provider", "openai").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("should accumulate tokens and cost")
    void shouldAccumulateTokensAndCost() {
        metrics.recordTokens("openai", "gpt-4o-mini", Usage.of(100, 20));
        metrics.recordTokens("openai", "gpt-4o-mini", Usage.of(50, 10));
        metrics.recordCost("openai", "gpt-4o-mini", new BigDecimal("0.0015"));

        assertThat(metrics.getRegistry().get("test_prefix_tokens_total")
                .tags("type", "prompt").counter().count()).isEqualTo(150.0);
        assertThat(metrics.getRegistry().get("test_prefix_tokens_total")
                .tags("type", "completion").counter().count()).isEqualTo(30.0);
        assertThat(metrics.getRegistry().get("test_prefix_cost_total").counter().count()).isEqualTo(0.0015);
    }

    @Test
    @DisplayName("should expose request, failover and health series in the scrape")
    void shouldExposeScrape() {
        AtomicInteger health = new AtomicInteger(2);
        metrics.registerProviderHealth("openai", health::get);
        metrics.recordRequest("fast-model", "success", Duration.ofMillis(120));
        metrics.incrementFailover("openai", "anthropic");
        metrics.incrementDroppedEvents();
        metrics.setRingBufferRemaining(512);

        String scrape = metrics.scrape();

        assertThat(scrape)
                .contains("test_prefix_requests_total{")
                .contains("model=\"fast-model\"")
                .contains("test_prefix_failovers_total{")
                .contains("test_prefix_provider_health{")
                .contains("test_prefix_events_dropped_total")
                .contains("test_prefix_ringbuffer_remaining")
                .contains("jvm_memory_used_bytes");
        assertThat(metrics.getRegistry().get("test_prefix_ringbuffer_remaining").gauge().value()).isEqualTo(512.0);

        health.set(0);
        assertThat(metrics.getRegistry().get("test_prefix_provider_health")
                .tag("provider", "openai").gauge().value()).isZero();
    }
}
