package fr.lapetina.airouter.provider.openai;

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
 * Adapter for the OpenAI chat completions API and compatible servers.
 */
public final class OpenAiAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiAdapter.class);

    private final ProviderEndpoint endpoint;
    private final ProviderHttpClient http;
    private final OpenAiStreamDialect dialect = new OpenAiStreamDialect();

    public OpenAiAdapter(ProviderEndpoint endpoint, ProviderHttpClient http) {
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
            httpRequest = completionRequest(toWire(request, false), callId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.info("Dispatching completion: providerId={}, requestId={}, callId={}, model={}",
                id(), request.id(), callId, request.model());

        return ProviderHttpClient.mapLinked(
                http.send(callId, httpRequest, endpoint.timeout()),
                body -> toCanonical(request, callId,
                        ProviderJson.read(body, OpenAiWire.ChatResponse.class, id(), callId),
                        AdapterSupport.elapsedMs(start))
        );
    }

    @Override
    public CompletableFuture<CompletionStream> openStream(CanonicalRequest request) {
        String callId = endpoint.newCallId();
        HttpRequest httpRequest;
        try {
            httpRequest = completionRequest(toWire(request, true), callId);
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
        HttpRequest probe = authorized(HttpRequest.newBuilder(endpoint.resolve("/models")))
                .timeout(endpoint.healthCheckTimeout())
                .GET()
                .build();
        return AdapterSupport.observeProbe(id(),
                http.probe(callId, probe, endpoint.healthCheckTimeout()), System.nanoTime());
    }

    OpenAiWire.ChatRequest toWire(CanonicalRequest request, boolean stream) {
        List<OpenAiWire.ChatMessage> messages = new ArrayList<>(request.messages().size());
        for (CanonicalRequest.Message message : request.messages()) {
            messages.add(new OpenAiWire.ChatMessage(message.role().wireName(), message.content()));
        }
        return new OpenAiWire.ChatRequest(
                request.model(),
                messages,
                request.maxTokens(),
                request.temperature(),
                request.topP(),
                request.stop().isEmpty() ? null : List.copyOf(request.stop()),
                request.userId(),
                stream ? Boolean.TRUE : null,
                stream ? new OpenAiWire.StreamOptions(true) : null
        );
    }

    private HttpRequest completionRequest(OpenAiWire.ChatRequest payload, String callId) {
        String body = ProviderJson.write(payload, id(), callId);
        return authorized(HttpRequest.newBuilder(endpoint.resolve("/chat/completions")))
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
        if (endpoint.organization() != null && !endpoint.organization().isBlank()) {
            builder.header("OpenAI-Organization", endpoint.organization());
        }
        return builder;
    }

    private CanonicalResponse toCanonical(
            CanonicalRequest request,
            String callId,
            OpenAiWire.ChatResponse response,
            long elapsedMs
    ) {
        OpenAiWire.Choice choice = response.firstChoice();
        String content = choice != null && choice.message() != null ? choice.message().content() : null;
        boolean hasContent = content != null && !content.isEmpty();
        FinishReason finishReason = choice != null ? mapFinishReason(choice.finishReason()) : null;
        if (finishReason == null) {
            finishReason = hasContent ? FinishReason.STOP : FinishReason.ERROR;
        }
        Usage usage = response.usage() != null
                ? Usage.ofNullable(response.usage().promptTokens(), response.usage().completionTokens())
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

    /**
     * Maps a vendor finish reason; null when the vendor gave none.
     */
    static FinishReason mapFinishReason(String reason) {
        if (reason == null) {
            return null;
        }
        return switch (reason) {
            case "length" -> FinishReason.LENGTH;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }

    @Override
    public void close() {
        http.close();
    }
}
