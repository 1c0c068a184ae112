package fr.lapetina.airouter.provider.anthropic;

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

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the Anthropic messages API.
 *
 * <p>System messages travel in the top-level {@code system} field, temperature is capped
 * at the vendor's maximum of 1.0, and stop sequences map to {@code stop_sequences}.
 */
public final class AnthropicAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAdapter.class);

    static final String DEFAULT_API_VERSION = "2023-06-01";
    private static final double MAX_TEMPERATURE = 1.0;

    private final ProviderEndpoint endpoint;
    private final ProviderHttpClient http;
    private final AnthropicStreamDialect dialect = new AnthropicStreamDialect();

    public AnthropicAdapter(ProviderEndpoint endpoint, ProviderHttpClient http) {
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
            httpRequest = messagesRequest(toWire(request, false), callId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Dispatching completion: providerId={}, requestId={}, callId={}, model={}",
                id(), request.id(), callId, request.model());

        return ProviderHttpClient.mapLinked(
                http.send(callId, httpRequest, endpoint.timeout()),
                body -> toCanonical(request, callId,
                        ProviderJson.read(body, AnthropicWire.MessagesResponse.class, id(), callId),
                        AdapterSupport.elapsedMs(start))
        );
    }

    @Override
    public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
        String callId = endpoint.newCallId();
        HttpRequest httpRequest;
        try {
            httpRequest = messagesRequest(toWire(request, true), callId);
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
        HttpRequest probe = authorized(HttpRequest.newBuilder(endpoint.resolve("/v1/models")))
                .timeout(endpoint.healthCheckTimeout())
                .GET()
                .build();
        return AdapterSupport.observeProbe(id(),
                http.probe(callId, probe, endpoint.healthCheckTimeout()), System.nanoTime());
    }

    AnthropicWire.MessagesRequest toWire(CanonicalRequest request, boolean stream) {
        SystemPrompt prompt = SystemPrompt.hoist(request.messages());
        List<AnthropicWire.Message> messages = new ArrayList<>(prompt.conversation().size());
        for (CanonicalRequest.Message message : prompt.conversation()) {
            messages.add(new AnthropicWire.Message(message.role().wireName(), message.content()));
        }
        return new AnthropicWire.MessagesRequest(
                request.model(),
                messages,
                request.maxTokens(),
                Math.min(request.temperature(), MAX_TEMPERATURE),
                request.topP(),
                prompt.hasSystem() ? prompt.system() : null,
                request.stop().isEmpty() ? null : List.copyOf(request.stop()),
                stream ? Boolean.TRUE : null,
                request.userId() != null ? new AnthropicWire.RequestMetadata(request.userId()) : null
        );
    }

    private HttpRequest messagesRequest(AnthropicWire.MessagesRequest payload, String callId) {
        String body = ProviderJson.write(payload, id(), callId);
        return authorized(HttpRequest.newBuilder(endpoint.resolve("/v1/messages")))
                .header("Content-Type", "application/json")
                .timeout(endpoint.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        if (endpoint.hasApiKey()) {
            builder.header("x-api-key", endpoint.apiKey());
        }
        String version = endpoint.apiVersion() != null ? endpoint.apiVersion() : DEFAULT_API_VERSION;
        return builder.header("anthropic-version", version);
    }

    private CanonicalResponse toCanonical(
            CanonicalRequest request,
            String callId,
            AnthropicWire.MessagesResponse response,
            long elapsedMs
    ) {
        String content = response.text();
        FinishReason finishReason = mapStopReason(response.stopReason());
        if (finishReason == null) {
            finishReason = content.isEmpty() ? FinishReason.ERROR : FinishReason.STOP;
        }
        Usage usage = response.usage() != null
                ? Usage.ofNullable(response.usage().inputTokens(), response.usage().outputTokens())
                : Usage.EMPTY;

        log.info("Completion received: providerId={}, requestId={}, callId={}, model={}, finishReason={}, latencyMs={}",
                id(), request.id(), callId, response.model(), finishReason, elapsedMs);

        return CanonicalResponse.builder()
                .id(response.id() != null ? response.id() : callId)
                .provider(id())
                .model(response.model() != null ? response.model() : request.model())
                .content(content)
                .usage(usage)
                .finishReason(finishReason)
                .responseTimeMs(elapsedMs)
                .metadata(ResponseMetadata.forCall(request.id(), callId, id(), false))
                .build();
    }

    static FinishReason mapStopReason(String reason) {
        if (reason == null) {
            return null;
        }
        return switch (reason) {
            case "max_tokens" -> FinishReason.LENGTH;
            case "refusal" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    @Override
    public void close() {
        http.close();
    }
}
