package fr.lapetina.airouter.domain.model;

import java.util.Locale;

/**
 * Why generation ended, normalized across vendors.
 */
public enum FinishReason {
    /** Natural end of output or a stop sequence was hit */
    STOP,

    /** Token limit reached */
    LENGTH,

    /** Output blocked or truncated by the vendor's safety filter */
    CONTENT_FILTER,

    /** Generation ended abnormally */
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
