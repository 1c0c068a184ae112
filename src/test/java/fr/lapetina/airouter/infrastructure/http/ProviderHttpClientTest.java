package fr.lapetina.airouter.infrastructure.http;

import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.model.ErrorKind;
import fr.lapetina.airouter.support.FakeVendorServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.airouter.support.Futures.providerFailure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderHttpClientTest {

    private FakeVendorServer server;
    private ProviderHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new FakeVendorServer();
        client = new ProviderHttpClient("vendor", Duration.ofSeconds(2), 2);
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(server.baseUrl().resolve(path)).GET().build();
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("should complete with the body of a 2xx response")
        void shouldReturnBody() throws Exception {
            server.reply("/ok", 200, "{\"hello\":true}");

            String body = client.send("c1", get("/ok"), Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS);

            assertThat(body).isEqualTo("{\"hello\":true}");
            assertThat(client.getInFlightRequests()).isZero();
        }

        @Test
        @DisplayName("should classify an error status and keep the vendor body")
        void shouldClassifyErrorStatus() throws Exception {
            server.reply("/limited", 429, "{\"error\":\"slow down\"}");

            ProviderException failure = providerFailure(client.send("c1", get("/limited"), Duration.ofSeconds(2)));

            assertThat(failure.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(failure.getStatusCode()).isEqualTo(429);
            assertThat(failure.getProviderId()).isEqualTo("vendor");
            assertThat(failure.getMessage()).contains("slow down");
        }

        @Test
        @DisplayName("should time out and release the slot")
        void shouldTimeOut() throws Exception {
            server.reply("/slow", 200, "{}", "application/json", 1500);

            ProviderException failure = providerFailure(client.send("c1", get("/slow"), Duration.ofMillis(150)));

            assertThat(failure.getKind()).isEqualTo(ErrorKind.TIMEOUT);
            assertThat(client.getInFlightRequests()).isZero();
        }

        @Test
        @DisplayName("should fail fast when the concurrency limit is reached")
        void shouldFailFastWhenSaturated() throws Exception {
            server.reply("/slow", 200, "{}", "application/json", 800);
            CompletableFuture<String> first = client.send("c1", get("/slow"), Duration.ofSeconds(3));
            CompletableFuture<String> second = client.send("c2", get("/slow"), Duration.ofSeconds(3));

            ProviderException failure = providerFailure(client.send("c3", get("/slow"), Duration.ofSeconds(3)));

            assertThat(failure.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
            assertThat(failure.getStatusCode()).isZero();
            assertThat(first.join()).isEqualTo("{}");
            assertThat(second.join()).isEqualTo("{}");
            assertThat(client.getInFlightRequests()).isZero();
        }

        @Test
        @DisplayName("should cancel when the caller cancels")
        void shouldReleaseOnCancel() throws Exception {
            server.reply("/slow", 200, "{}", "application/json", 1500);
            CompletableFuture<String> call = client.send("c1", get("/slow"), Duration.ofSeconds(5));

            call.cancel(true);

            assertThat(call).isCancelled();
            long waitUntil = System.currentTimeMillis() + 3000;
            while (client.getInFlightRequests() > 0 && System.currentTimeMillis() < waitUntil) {
                Thread.sleep(20);
            }
            assertThat(client.getInFlightRequests()).isZero();
        }
    }

    @Nested
    @DisplayName("openStream")
    class OpenStream {

        @Test
        @DisplayName("should hold the slot until the body is closed")
        void shouldHoldSlotUntilClosed() throws Exception {
            server.reply("/stream", 200, "data: one\n\ndata: two\n\n", "text/event-stream", 0);

            InputStream body = client.openStream("c1", get("/stream"), Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS);

            assertThat(client.getInFlightRequests()).isEqualTo(1);
            assertThat(new String(body.readAllBytes(), StandardCharsets.UTF_8)).contains("data: two");
            body.close();
            body.close();
            assertThat(client.getInFlightRequests()).isZero();
        }

        @Test
        @DisplayName("should classify an error status before any byte is streamed")
        void shouldClassifyOpenFailure() throws Exception {
            server.reply("/stream", 503, "{\"error\":\"overloaded\"}");

            ProviderException failure = providerFailure(client.openStream("c1", get("/stream"), Duration.ofSeconds(2)));

            assertThat(failure.getKind()).isEqualTo(ErrorKind.UPSTREAM_5XX);
            assertThat(client.getInFlightRequests()).isZero();
        }
    }

    @Nested
    @DisplayName("probe")
    class Probe {

        @Test
        @DisplayName("should report any status without failing")
        void shouldReportStatus() throws Exception {
            server.reply("/models", 503, "");

            assertThat(client.probe("p1", get("/models"), Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS))
                    .isEqualTo(503);
        }

        @Test
        @DisplayName("should ignore the concurrency limit")
        void shouldIgnoreConcurrencyLimit() throws Exception {
            server.reply("/slow", 200, "{}", "application/json", 600);
            server.reply("/models", 200, "{}");
            client.send("c1", get("/slow"), Duration.ofSeconds(3));
            client.send("c2", get("/slow"), Duration.ofSeconds(3));

            assertThat(client.probe("p1", get("/models"), Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS))
                    .isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        @DisplayName("should map connection errors to upstream failures")
        void shouldMapConnectionErrors() throws Exception {
            ProviderException mapped = client.classify(
                    new CompletionException(new ConnectException("refused")), "c1");

            assertThat(mapped.getKind()).isEqualTo(ErrorKind.UPSTREAM_5XX);
            assertThat(mapped.getCause()).isInstanceOf(ConnectException.class);
        }

        @Test
        @DisplayName("should pass provider exceptions through")
        void shouldPassThrough() throws Exception {
            ProviderException original = new ProviderException(ErrorKind.AUTH, 401, "vendor", "c1", "bad key");

            assertThat(client.classify(new CompletionException(original), "c1")).isSameAs(original);
        }

        @Test
        @DisplayName("should map anything else to unknown")
        void shouldMapUnknown() throws Exception {
            assertThat(client.classify(new IllegalStateException("boom"), "c1").getKind())
                    .isEqualTo(ErrorKind.UNKNOWN);
        }
    }

    @Test
    @DisplayName("should reject a zero concurrency limit")
    void shouldRejectZeroLimit() {
        assertThatThrownBy(() -> new ProviderHttpClient("vendor", Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
