package fr.lapetina.airouter.provider.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Chat completions wire format.
 */
final class OpenAiWire {

    private OpenAiWire() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatRequest(
            String model,
            List<ChatMessage> messages,
            @JsonProperty("max_tokens") Integer maxTokens,
            Double temperature,
            @JsonProperty("top_p") Double topP,
            List<String> stop,
            String user,
            Boolean stream,
            @JsonProperty("stream_options") StreamOptions streamOptions
    ) {
    }

    record StreamOptions(@JsonProperty("include_usage") boolean includeUsage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatMessage(String role, String content) {
    }

    /**
     * Full response and stream chunk share this shape; chunks carry {@code delta} instead of {@code message}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(String id, String model, List<Choice> choices, TokenUsage usage) {
        Choice firstChoice() {
            return choices != null && !choices.isEmpty() ? choices.get(0) : null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(
            Integer index,
            ChatMessage message,
            ChatMessage delta,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenUsage(
            @JsonProperty("prompt_tokens") Integer promptTokens,
            @JsonProperty("completion_tokens") Integer completionTokens
    ) {
    }
}
