package fr.lapetina.airouter.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported vendor wire protocols.
 */
public enum ProviderType {
    /** OpenAI chat completions and compatible servers */
    OPENAI,

    /** Anthropic messages API */
    ANTHROPIC,

    /** Google Gemini generateContent API */
    GEMINI,

    /** Ollama chat API */
    OLLAMA;

    public static Optional<ProviderType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "openai-compatible" -> Optional.of(OPENAI);
            case "anthropic", "claude" -> Optional.of(ANTHROPIC);
            case "gemini", "google" -> Optional.of(GEMINI);
            case "ollama" -> Optional.of(OLLAMA);
            default -> Optional.empty();
        };
    }
}
