package ai.pipestream.transfer.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * JSON encoding of metadata values.
 */
@ApplicationScoped
public class MetadataCodec {

    private final ObjectMapper mapper;

    @Inject
    public MetadataCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Codec with a standalone mapper, for use outside the container.
     */
    public static MetadataCodec standalone() {
        return new MetadataCodec(JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * @return the decoded value, or null for a null input
     */
    public <T> T decode(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt metadata value for " + type.getSimpleName(), e);
        }
    }
}
