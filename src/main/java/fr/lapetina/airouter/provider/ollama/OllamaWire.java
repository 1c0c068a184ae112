package fr.lapetina.airouter.provider.ollama;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code /api/chat} wire format. Streaming responses are one {@link ChatResponse} per line.
 */
final class OllamaWire {

    private OllamaWire() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ChatRequest(
            String model,
            List<Message> messages,
            boolean stream,
            Options options
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Options(
            Double temperature,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("num_predict") Integer numPredict,
            List<String> stop
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(
            String model,
            Message message,
            Boolean done,
            @JsonProperty("done_reason") String doneReason,
            @JsonProperty("prompt_eval_count") Integer promptEvalCount,
            @JsonProperty("eval_count") Integer evalCount,
            String error
    ) {
        boolean isDone() {
            return Boolean.TRUE.equals(done);
        }

        String text() {
            return message != null && message.content() != null ? message.content() : "";
        }
    }
}
