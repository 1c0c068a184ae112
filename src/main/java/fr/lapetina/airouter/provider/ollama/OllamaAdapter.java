package fr.lapetina.airouter.provider.ollama;

import fr.lapetina.airouter.domain.model.CanonicalRequest;
import fr.lapetina.airouter.domain.model.CanonicalResponse;
import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.domain.model.ProviderHealth;
import fr.lapetina.airouter.domain.model.ResponseMetadata;
import fr.lapetina.airouter.domain.model.Usage;
import fr.lapetina.airouter.infrastructure.http.ProviderHttpClient;
import fr.lapetina.airouter.provider.AdapterSupport;
import fr.lapetina.airouter.provider.ProviderAdapter;
import fr.lapetina.airouter.provider.ProviderEndpoint;
import fr.lapetina.airouter.provider.ProviderJson;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.streaming.StreamNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for a self-hosted Ollama server.
 *
 * <p>Sampling parameters travel in {@code options}; the token limit is {@code num_predict}.
 * The server streams by default, so {@code stream} is always sent explicitly.
 */
public final class OllamaAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(OllamaAdapter.class);

    private final ProviderEndpoint endpoint;
    private final ProviderHttpClient http;
    private final OllamaStreamDialect dialect = new OllamaStreamDialect();

    public OllamaAdapter(ProviderEndpoint endpoint, ProviderHttpClient http) {
        this.endpoint = endpoint;
        this.http = http;
    }

    @Override
    public String id() {
        return endpoint.id();
    }

    @Override
    public CompletableFuture<CanonicalResponse> process(CanonicalRequest request) {
        String callId = endpoint.newCallId();
        long start = System.nanoTime();
        HttpRequest httpRequest;
        try {
            httpRequest = chatRequest(toWire(request, false), callId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Dispatching completion: providerId={}, requestId={}, callId={}, model={}",
                id(), request.id(), callId, request.model());

        return ProviderHttpClient.mapLinked(
                http.send(callId, httpRequest, endpoint.timeout()),
                body -> toCanonical(request, callId,
                        ProviderJson.read(body, OllamaWire.ChatResponse.class, id(), callId),
                        AdapterSupport.elapsedMs(start))
        );
    }

    @Override
    public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
        String callId = endpoint.newCallId();
        HttpRequest httpRequest;
        try {
            httpRequest = chatRequest(toWire(request, true), callId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Opening completion stream: providerId={}, requestId={}, callId={}, model={}",
                id(), request.id(), callId, request.model());

        return AdapterSupport.linkStream(
                http.openStream(callId, httpRequest, endpoint.timeout()),
                body -> new StreamNormalizer(body, dialect, id(), request.id(), callId, request.model())
        );
    }

    @Override
    public CompletableFuture<ProviderHealth> healthCheck() {
        String callId = endpoint.newCallId();
        HttpRequest probe = authorized(HttpRequest.newBuilder(endpoint.resolve("/api/tags")))
                .timeout(endpoint.healthCheckTimeout())
                .GET()
                .build();
        return AdapterSupport.observeProbe(id(),
                http.probe(callId, probe, endpoint.healthCheckTimeout()), System.nanoTime());
    }

    OllamaWire.ChatRequest toWire(CanonicalRequest request, boolean stream) {
        List<OllamaWire.Message> messages = new ArrayList<>(request.messages().size());
        for (CanonicalRequest.Message message : request.messages()) {
            messages.add(new OllamaWire.Message(message.role().wireName(), message.content()));
        }
        OllamaWire.Options options = new OllamaWire.Options(
                request.temperature(),
                request.topP(),
                request.maxTokens(),
                request.stop().isEmpty() ? null : List.copyOf(request.stop())
        );
        return new OllamaWire.ChatRequest(request.model(), messages, stream, options);
    }

    private HttpRequest chatRequest(OllamaWire.ChatRequest payload, String callId) {
        String body = ProviderJson.write(payload, id(), callId);
        return authorized(HttpRequest.newBuilder(endpoint.resolve("/api/chat")))
                .header("Content-Type", "application/json")
                .header("X-Request-ID", callId)
                .timeout(endpoint.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (endpoint.hasApiKey()) {
            builder.header("Authorization", "Bearer " + endpoint.apiKey());
        }
        return builder;
    }

    private CanonicalResponse toCanonical(
            CanonicalRequest request,
            String callId,
            OllamaWire.ChatResponse response,
            long elapsedMs
    ) {
        String content = response.text();
        FinishReason finishReason = mapDoneReason(response.doneReason());
        if (finishReason == null) {
            finishReason = content.isEmpty() ? FinishReason.ERROR : FinishReason.STOP;
        }

        log.info("Completion received: providerId={}, requestId={}, callId={}, model={}, finishReason={}, latencyMs={}",
                id(), request.id(), callId, response.model(), finishReason, elapsedMs);

        return CanonicalResponse.builder()
                .id(callId)
                .provider(id())
                .model(response.model() != null ? response.model() : request.model())
                .content(content)
                .usage(Usage.ofNullable(response.promptEvalCount(), response.evalCount()))
                .finishReason(finishReason)
                .responseTimeMs(elapsedMs)
                .metadata(ResponseMetadata.forCall(request.id(), callId, id(), false))
                .build();
    }

    static FinishReason mapDoneReason(String reason) {
        if (reason == null) {
            return null;
        }
        return "length".equals(reason) ? FinishReason.LENGTH : FinishReason.STOP;
    }

    @Override
    public void close() {
        http.close();
    }
}
