package fr.lapetina.airouter.provider.gemini;

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
import fr.lapetina.airouter.provider.SystemPrompt;
import fr.lapetina.airouter.streaming.CompletionStream;
import fr.lapetina.airouter.streaming.StreamNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the Google Gemini generateContent API.
 *
 * <p>The system prompt is hoisted into {@code systemInstruction} and assistant turns use
 * the vendor's {@code model} role.
 */
public final class GeminiAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(GeminiAdapter.class);

    private final ProviderEndpoint endpoint;
    private final ProviderHttpClient http;
    private final GeminiStreamDialect dialect = new GeminiStreamDialect();

    public GeminiAdapter(ProviderEndpoint endpoint, ProviderHttpClient http) {
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
            httpRequest = generateRequest(request, ":generateContent", callId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Dispatching completion: providerId={}, requestId={}, callId={}, model={}",
                id(), request.id(), callId, request.model());

        return ProviderHttpClient.mapLinked(
                http.send(callId, httpRequest, endpoint.timeout()),
                body -> toCanonical(request, callId,
                        ProviderJson.read(body, GeminiWire.GenerateResponse.class, id(), callId),
                        AdapterSupport.elapsedMs(start))
        );
    }

    @Override
    public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
        String callId = endpoint.newCallId();
        HttpRequest httpRequest;
        try {
            httpRequest = generateRequest(request, ":streamGenerateContent?alt=sse", callId);
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
        HttpRequest probe = authorized(HttpRequest.newBuilder(endpoint.resolve("/v1beta/models")))
                .timeout(endpoint.healthCheckTimeout())
                .GET()
                .build();
        return AdapterSupport.observeProbe(id(),
                http.probe(callId, probe, endpoint.healthCheckTimeout()), System.nanoTime());
    }

    GeminiWire.GenerateRequest toWire(CanonicalRequest request) {
        SystemPrompt prompt = SystemPrompt.hoist(request.messages());
        List<GeminiWire.Content> contents = new ArrayList<>(prompt.conversation().size());
        for (CanonicalRequest.Message message : prompt.conversation()) {
            String role = message.role() == CanonicalRequest.Role.ASSISTANT ? "model" : "user";
            contents.add(new GeminiWire.Content(role, List.of(new GeminiWire.Part(message.content()))));
        }
        GeminiWire.Content systemInstruction = prompt.hasSystem()
                ? new GeminiWire.Content(null, List.of(new GeminiWire.Part(prompt.system())))
                : null;
        GeminiWire.GenerationConfig config = new GeminiWire.GenerationConfig(
                request.maxTokens(),
                request.temperature(),
                request.topP(),
                request.stop().isEmpty() ? null : List.copyOf(request.stop())
        );
        return new GeminiWire.GenerateRequest(contents, systemInstruction, config);
    }

    private HttpRequest generateRequest(CanonicalRequest request, String action, String callId) {
        String body = ProviderJson.write(toWire(request), id(), callId);
        String path = "/v1beta/models/" + URLEncoder.encode(request.model(), StandardCharsets.UTF_8) + action;
        return authorized(HttpRequest.newBuilder(endpoint.resolve(path)))
                .header("Content-Type", "application/json")
                .timeout(endpoint.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (endpoint.hasApiKey()) {
            builder.header("x-goog-api-key", endpoint.apiKey());
        }
        return builder;
    }

    private CanonicalResponse toCanonical(
            CanonicalRequest request,
            String callId,
            GeminiWire.GenerateResponse response,
            long elapsedMs
    ) {
        String content = response.text();
        GeminiWire.Candidate candidate = response.firstCandidate();
        FinishReason finishReason = candidate != null ? mapFinishReason(candidate.finishReason()) : null;
        if (response.promptBlocked()) {
            finishReason = FinishReason.CONTENT_FILTER;
        } else if (finishReason == null) {
            finishReason = content.isEmpty() ? FinishReason.ERROR : FinishReason.STOP;
        }
        GeminiWire.UsageMetadata usage = response.usageMetadata();

        log.info("Completion received: providerId={}, requestId={}, callId={}, model={}, finishReason={}, latencyMs={}",
                id(), request.id(), callId, request.model(), finishReason, elapsedMs);

        return CanonicalResponse.builder()
                .id(callId)
                .provider(id())
                .model(response.modelVersion() != null ? response.modelVersion() : request.model())
                .content(content)
                .usage(usage != null
                        ? Usage.ofNullable(usage.promptTokenCount(), usage.candidatesTokenCount())
                        : Usage.EMPTY)
                .finishReason(finishReason)
                .responseTimeMs(elapsedMs)
                .metadata(ResponseMetadata.forCall(request.id(), callId, id(), false))
                .build();
    }

    static FinishReason mapFinishReason(String reason) {
        if (reason == null || "FINISH_REASON_UNSPECIFIED".equals(reason)) {
            return null;
        }
        return switch (reason) {
            case "MAX_TOKENS" -> FinishReason.LENGTH;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    @Override
    public void close() {
        http.close();
    }
}
