package fr.lapetina.airouter.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.airouter.domain.exception.ProviderException;
import fr.lapetina.airouter.domain.model.ErrorKind;

/**
 * Jackson settings shared by every adapter's wire records.
 * Unknown vendor fields are ignored and null fields are never sent.
 */
public final class ProviderJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ProviderJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes an outbound payload; failure here is a programming error on our side.
     */
    public static String write(Object payload, String providerId, String callId) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.BAD_REQUEST, 0, providerId, callId,
                    "Failed to encode request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes a 2xx body; an undecodable body is classified {@link ErrorKind#UNKNOWN}.
     */
    public static <T> T read(String body, Class<T> type, String providerId, String callId) {
        try {
            return MAPPER.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ErrorKind.UNKNOWN, 200, providerId, callId,
                    "Failed to decode response: " + e.getOriginalMessage(), e);
        }
    }
}
