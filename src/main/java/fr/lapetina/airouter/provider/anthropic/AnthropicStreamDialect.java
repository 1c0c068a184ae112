package fr.lapetina.airouter.provider.anthropic;

import fr.lapetina.airouter.provider.ProviderJson;
import fr.lapetina.airouter.streaming.StreamDelta;
import fr.lapetina.airouter.streaming.StreamDialect;

import java.io.IOException;
import java.util.Optional;

/**
 * Typed server-sent events. Prompt tokens come with {@code message_start}, text with
 * {@code content_block_delta}, the stop reason and output tokens with {@code message_delta};
 * {@code message_stop} ends the stream.
 */
public final class AnthropicStreamDialect implements StreamDialect {

    @Override
    public Optional<String> payload(String line) {
        return StreamDialect.ssePayload(line);
    }

    @Override
    public StreamDelta decode(String payload) throws IOException {
        AnthropicWire.StreamEvent event = ProviderJson.mapper().readValue(payload, AnthropicWire.StreamEvent.class);
        if (event.type() == null) {
            throw new IOException("Stream event without type");
        }
        return switch (event.type()) {
            case "message_start" -> messageStart(event);
            case "content_block_delta" -> event.delta() != null
                    ? StreamDelta.text(event.delta().text())
                    : StreamDelta.NONE;
            case "message_delta" -> new StreamDelta(
                    null,
                    event.usage() != null ? event.usage().inputTokens() : null,
                    event.usage() != null ? event.usage().outputTokens() : null,
                    event.delta() != null ? AnthropicAdapter.mapStopReason(event.delta().stopReason()) : null,
                    null,
                    false,
                    null
            );
            case "message_stop" -> StreamDelta.END;
            case "error" -> StreamDelta.error(event.error() != null
                    ? event.error().type() + ": " + event.error().message()
                    : "unspecified");
            default -> StreamDelta.NONE;
        };
    }

    private StreamDelta messageStart(AnthropicWire.StreamEvent event) {
        AnthropicWire.MessagesResponse message = event.message();
        if (message == null) {
            return StreamDelta.NONE;
        }
        AnthropicWire.TokenUsage usage = message.usage();
        return new StreamDelta(
                null,
                usage != null ? usage.inputTokens() : null,
                usage != null ? usage.outputTokens() : null,
                null,
                message.model(),
                false,
                null
        );
    }
}
