package configstore.domain.marshal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import configstore.domain.exceptions.DeserializationFailed;
import configstore.domain.exceptions.SerializationFailed;
import io.vavr.control.Try;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A format backed by a Jackson mapper. The text formats (JSON, TOML, YAML) and the binary CBOR format share the
 * same object model, so a value written in one format reads back the same from any other.
 */
public class JacksonMarshaller implements Marshaller {
    private final String name;
    private final String extension;
    private final ObjectMapper objectMapper;

    public JacksonMarshaller(final String name, final String extension, final ObjectMapper objectMapper) {
        this.name = checkNotNull(name);
        this.extension = checkNotNull(extension);
        this.objectMapper = configure(checkNotNull(objectMapper));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String extension() {
        return extension;
    }

    @Override
    public byte[] marshal(final Object value) {
        return Try.of(() -> objectMapper.writeValueAsBytes(value))
                .getOrElseThrow(ex -> new SerializationFailed(
                        "Failed to encode " + describe(value) + " as " + name + ": " + ex.getMessage(), ex));
    }

    @Override
    public <T> T unmarshal(final byte[] data, final Class<T> type) {
        return Try.of(() -> objectMapper.readValue(data, type))
                .getOrElseThrow(ex -> new DeserializationFailed(
                        "Failed to decode " + name + " into " + type.getSimpleName() + ": " + ex.getMessage(), ex));
    }

    @Override
    public String toString() {
        return name;
    }

    private static String describe(final Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static ObjectMapper configure(final ObjectMapper objectMapper) {
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new BlackbirdModule());
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // Stored documents may carry fields the target type does not declare
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }
}
