package fr.lapetina.airouter.provider.gemini;

import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.provider.ProviderJson;
import fr.lapetina.airouter.streaming.StreamDelta;
import fr.lapetina.airouter.streaming.StreamDialect;

import java.io.IOException;
import java.util.Optional;

/**
 * {@code alt=sse} framing: each {@code data:} line is a complete response chunk with
 * cumulative usage. There is no sentinel; the stream ends with the connection.
 */
public final class GeminiStreamDialect implements StreamDialect {

    @Override
    public Optional<String> payload(String line) {
        return StreamDialect.ssePayload(line);
    }

    @Override
    public StreamDelta decode(String payload) throws IOException {
        GeminiWire.GenerateResponse chunk = ProviderJson.mapper().readValue(payload, GeminiWire.GenerateResponse.class);

        GeminiWire.Candidate candidate = chunk.firstCandidate();
        FinishReason finishReason = candidate != null ? GeminiAdapter.mapFinishReason(candidate.finishReason()) : null;
        if (chunk.promptBlocked()) {
            finishReason = FinishReason.CONTENT_FILTER;
        }
        GeminiWire.UsageMetadata usage = chunk.usageMetadata();
        return new StreamDelta(
                chunk.text(),
                usage != null ? usage.promptTokenCount() : null,
                usage != null ? usage.candidatesTokenCount() : null,
                finishReason,
                chunk.modelVersion(),
                false,
                null
        );
    }
}
