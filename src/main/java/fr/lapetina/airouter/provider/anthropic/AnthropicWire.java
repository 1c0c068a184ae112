package fr.lapetina.airouter.provider.anthropic;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Messages API wire format.
 */
final class AnthropicWire {

    private AnthropicWire() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MessagesRequest(
            String model,
            List<Message> messages,
            @JsonProperty("max_tokens") int maxTokens,
            Double temperature,
            @JsonProperty("top_p") Double topP,
            String system,
            @JsonProperty("stop_sequences") List<String> stopSequences,
            Boolean stream,
            RequestMetadata metadata
    ) {
    }

    record Message(String role, String content) {
    }

    record RequestMetadata(@JsonProperty("user_id") String userId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(
            String id,
            String model,
            List<ContentBlock> content,
            @JsonProperty("stop_reason") String stopReason,
            TokenUsage usage
    ) {
        /**
         * Concatenated text of all text blocks.
         */
        String text() {
            if (content == null) {
                return "";
            }
            StringBuilder text = new StringBuilder();
            for (ContentBlock block : content) {
                if ("text".equals(block.type()) && block.text() != null) {
                    text.append(block.text());
                }
            }
            return text.toString();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlock(String type, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenUsage(
            @JsonProperty("input_tokens") Integer inputTokens,
            @JsonProperty("output_tokens") Integer outputTokens
    ) {
    }

    /**
     * One server-sent event; which fields are present depends on {@code type}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamEvent(
            String type,
            MessagesResponse message,
            Delta delta,
            TokenUsage usage,
            ErrorBody error
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Delta(
            String type,
            String text,
            @JsonProperty("stop_reason") String stopReason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorBody(String type, String message) {
    }
}
