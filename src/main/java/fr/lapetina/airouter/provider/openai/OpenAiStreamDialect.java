package fr.lapetina.airouter.provider.openai;

import fr.lapetina.airouter.domain.model.FinishReason;
import fr.lapetina.airouter.provider.ProviderJson;
import fr.lapetina.airouter.streaming.StreamDelta;
import fr.lapetina.airouter.streaming.StreamDialect;

import java.io.IOException;
import java.util.Optional;

/**
 * Server-sent events with {@code data:} lines, terminated by {@code data: [DONE]}.
 * Usage arrives on a final chunk with an empty choices list.
 */
public final class OpenAiStreamDialect implements StreamDialect {

    static final String DONE = "[DONE]";

    @Override
    public Optional<String> payload(String line) {
        return StreamDialect.ssePayload(line);
    }

    @Override
    public boolean isSentinel(String payload) {
        return DONE.equals(payload);
    }

    @Override
    public StreamDelta decode(String payload) throws IOException {
        OpenAiWire.ChatResponse chunk = ProviderJson.mapper().readValue(payload, OpenAiWire.ChatResponse.class);

        String text = null;
        FinishReason finishReason = null;
        OpenAiWire.Choice choice = chunk.firstChoice();
        if (choice != null) {
            if (choice.delta() != null) {
                text = choice.delta().content();
            }
            finishReason = OpenAiAdapter.mapFinishReason(choice.finishReason());
        }

        Integer promptTokens = chunk.usage() != null ? chunk.usage().promptTokens() : null;
        Integer completionTokens = chunk.usage() != null ? chunk.usage().completionTokens() : null;
        return new StreamDelta(text, promptTokens, completionTokens, finishReason, chunk.model(), false, null);
    }
}
