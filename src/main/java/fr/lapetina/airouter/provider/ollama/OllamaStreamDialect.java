package fr.lapetina.airouter.provider.ollama;

import fr.lapetina.airouter.provider.ProviderJson;
import fr.lapetina.airouter.streaming.StreamDelta;
import fr.lapetina.airouter.streaming.StreamDialect;

import java.io.IOException;
import java.util.Optional;

/**
 * Newline-delimited JSON; the object with {@code done: true} carries the token counts and
 * ends the stream.
 */
public final class OllamaStreamDialect implements StreamDialect {

    @Override
    public Optional<String> payload(String line) {
        return StreamDialect.ndjsonPayload(line);
    }

    @Override
    public StreamDelta decode(String payload) throws IOException {
        OllamaWire.ChatResponse chunk = ProviderJson.mapper().readValue(payload, OllamaWire.ChatResponse.class);
        if (chunk.error() != null) {
            return StreamDelta.error(chunk.error());
        }
        boolean done = chunk.isDone();
        return new StreamDelta(
                chunk.text(),
                chunk.promptEvalCount(),
                chunk.evalCount(),
                done ? OllamaAdapter.mapDoneReason(chunk.doneReason()) : null,
                chunk.model(),
                done,
                null
        );
    }
}
