package fr.lapetina.airouter.streaming;

import fr.lapetina.airouter.domain.model.FinishReason;

/**
 * What a dialect extracted from one stream payload. Every field is optional.
 *
 * @param promptTokens     cumulative prompt tokens reported by this payload, or null
 * @param completionTokens cumulative completion tokens reported by this payload, or null
 * @param terminal         the payload marks the end of the stream
 * @param error            vendor-reported in-band error; ends the stream as failed
 */
public record StreamDelta(
        String text,
        Integer promptTokens,
        Integer completionTokens,
        FinishReason finishReason,
        String model,
        boolean terminal,
        String error
) {
    public static final StreamDelta NONE = new StreamDelta(null, null, null, null, null, false, null);
    public static final StreamDelta END = new StreamDelta(null, null, null, null, null, true, null);

    public static StreamDelta text(String text) {
        return new StreamDelta(text, null, null, null, null, false, null);
    }

    public static StreamDelta error(String message) {
        return new StreamDelta(null, null, null, null, null, true, message);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
