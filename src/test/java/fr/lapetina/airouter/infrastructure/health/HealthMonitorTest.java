package fr.lapetina.airouter.infrastructure.health;

import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.domain.model.HealthStatus;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.support.StubProviderAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthMonitorTest {

    private StubProviderAdapter adapter;
    private ProviderHealthTable table;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        adapter = new StubProviderAdapter("p1");
        table = new ProviderHealthTable();
        monitor = new HealthMonitor(Map.of("p1", adapter), table, Duration.ofMillis(200), 3);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    @Test
    @DisplayName("should start every provider as healthy before the first probe")
    void shouldStartHealthy() {
        ProviderHealth health = monitor.currentStatus("p1");

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.lastCheckedAt()).isNull();
        assertThat(health.consecutiveFailures()).isZero();
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        @DisplayName("should degrade then turn unhealthy at the threshold")
        void shouldTurnUnhealthyAtThreshold() {
            adapter.health(() -> CompletableFuture.completedFuture(
                    ProviderHealth.degraded("p1", 12, "HTTP 503")));

            assertThat(monitor.probe("p1").status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(monitor.probe("p1").status()).isEqualTo(HealthStatus.DEGRADED);
            ProviderHealth third = monitor.probe("p1");

            assertThat(third.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(third.consecutiveFailures()).isEqualTo(3);
            assertThat(third.detail()).isEqualTo("HTTP 503");
        }

        @Test
        @DisplayName("should reset to healthy after one successful probe")
        void shouldResetOnSuccess() {
            adapter.health(() -> CompletableFuture.completedFuture(ProviderHealth.unhealthy("p1", "refused")));
            monitor.probe("p1");
            monitor.probe("p1");
            monitor.probe("p1");
            assertThat(monitor.currentStatus("p1").status()).isEqualTo(HealthStatus.UNHEALTHY);

            adapter.health(() -> CompletableFuture.completedFuture(ProviderHealth.healthy("p1", 5)));
            ProviderHealth recovered = monitor.probe("p1");

            assertThat(recovered.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(recovered.consecutiveFailures()).isZero();
            assertThat(recovered.lastCheckedAt()).isNotNull();
        }

        @Test
        @DisplayName("should count a probe that never answers as a failure")
        void shouldTimeOutProbe() {
            adapter.health(CompletableFuture::new);

            long start = System.nanoTime();
            ProviderHealth health = monitor.probe("p1");

            assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(health.detail()).isEqualTo("probe timed out");
            assertThat(health.consecutiveFailures()).isEqualTo(1);
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2000);
        }

        @Test
        @DisplayName("should count a throwing health check as a failure")
        void shouldRecordThrowingHealthCheck() {
            adapter.health(() -> {
                throw new IllegalStateException("boom");
            });

            ProviderHealth health = monitor.probe("p1");

            assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(health.detail()).contains("boom");
        }
    }

    @Nested
    @DisplayName("probe coalescing")
    class Coalescing {

        @Test
        @DisplayName("should share one in-flight probe between concurrent triggers")
        void shouldShareInFlightProbe() throws Exception {
            CompletableFuture<ProviderHealth> pending = new CompletableFuture<>();
            adapter.health(() -> pending);

            CompletableFuture<ProviderHealth> first = monitor.probeAsync("p1");
            CompletableFuture<ProviderHealth> second = monitor.probeAsync("p1");

            assertThat(second).isSameAs(first);
            assertThat(adapter.getProbeCount()).isEqualTo(1);

            pending.complete(ProviderHealth.healthy("p1", 3));
            assertThat(first.get(1, TimeUnit.SECONDS).status()).isEqualTo(HealthStatus.HEALTHY);

            // the slot is free again once the probe completed
            monitor.probe("p1");
            assertThat(adapter.getProbeCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should fail probing an unknown provider")
        void shouldFailUnknownProvider() {
            assertThatThrownBy(() -> monitor.probeAsync("nope").get(1, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> monitor.currentStatus("nope"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("live call failures")
    class CallFailures {

        @Test
        @DisplayName("should degrade and trigger a probe on a provider-side failure")
        void shouldDegradeOnProviderFailure() {
            adapter.health(CompletableFuture::new);

            monitor.reportCallFailure("p1", ErrorKind.UPSTREAM_5XX);

            ProviderHealth health = monitor.currentStatus("p1");
            assertThat(health.status()).isEqualTo(HealthStatus.DEGRADED);
            assertThat(health.detail()).isEqualTo("call failed: upstream_5xx");
            assertThat(health.consecutiveFailures()).isZero();
            assertThat(adapter.getProbeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore request-shape failures")
        void shouldIgnoreAuthFailures() {
            monitor.reportCallFailure("p1", ErrorKind.AUTH);
            monitor.reportCallFailure("p1", ErrorKind.BAD_REQUEST);

            assertThat(monitor.currentStatus("p1").status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(adapter.getProbeCount()).isZero();
        }

        @Test
        @DisplayName("should recover when the triggered probe succeeds")
        void shouldRecoverAfterSuccessfulProbe() {
            monitor.reportCallFailure("p1", ErrorKind.TIMEOUT);

            assertThat(monitor.currentStatus("p1").status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(adapter.getProbeCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should probe in the background at the configured interval")
    void shouldProbeInBackground() throws Exception {
        monitor.startBackgroundProbing(Duration.ofMillis(50));

        long deadline = System.currentTimeMillis() + 2000;
        while (adapter.getProbeCount() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertThat(adapter.getProbeCount()).isGreaterThanOrEqualTo(3);
        assertThat(monitor.currentStatus("p1").lastCheckedAt()).isNotNull();
    }
}
