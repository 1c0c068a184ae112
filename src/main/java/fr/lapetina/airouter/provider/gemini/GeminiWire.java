package fr.lapetina.airouter.provider.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * generateContent wire format. Field names are camelCase on this vendor's wire.
 */
final class GeminiWire {

    private GeminiWire() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateRequest(
            List<Content> contents,
            Content systemInstruction,
            GenerationConfig generationConfig
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Content(String role, List<Part> parts) {
        String text() {
            if (parts == null) {
                return "";
            }
            StringBuilder text = new StringBuilder();
            for (Part part : parts) {
                if (part.text() != null) {
                    text.append(part.text());
                }
            }
            return text.toString();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerationConfig(
            Integer maxOutputTokens,
            Double temperature,
            Double topP,
            List<String> stopSequences
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(
            List<Candidate> candidates,
            UsageMetadata usageMetadata,
            PromptFeedback promptFeedback,
            String modelVersion
    ) {
        Candidate firstCandidate() {
            return candidates != null && !candidates.isEmpty() ? candidates.get(0) : null;
        }

        String text() {
            Candidate candidate = firstCandidate();
            return candidate != null && candidate.content() != null ? candidate.content().text() : "";
        }

        boolean promptBlocked() {
            return promptFeedback != null && promptFeedback.blockReason() != null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content, String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UsageMetadata(Integer promptTokenCount, Integer candidatesTokenCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PromptFeedback(String blockReason) {
    }
}
