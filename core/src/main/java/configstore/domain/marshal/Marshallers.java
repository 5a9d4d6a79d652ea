package configstore.domain.marshal;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The known formats. {@link #KNOWN} is the default preference order: the first entry is the format used when a
 * multi-format store writes a bare key, and the first candidate tried when it reads one.
 */
public final class Marshallers {
    public static final Marshaller TOML = new JacksonMarshaller("toml", "toml", new TomlMapper());
    public static final Marshaller JSON = new JacksonMarshaller("json", "json", new JsonMapper());
    public static final Marshaller YAML = new JacksonMarshaller("yaml", "yaml", new YAMLMapper());
    public static final Marshaller CBOR = new JacksonMarshaller("cbor", "cbor", new CBORMapper());

    public static final List<Marshaller> KNOWN = List.of(TOML, JSON, YAML, CBOR);

    private Marshallers() {
    }

    /**
     * Finds a known format by its configuration name, ignoring case.
     */
    public static Optional<Marshaller> byName(final String name) {
        return KNOWN.stream()
                .filter(marshaller -> marshaller.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Finds the format whose extension ends the stored name. When several extensions match, the longest wins.
     */
    public static Optional<Marshaller> byExtension(final List<Marshaller> marshallers, final String path) {
        return marshallers.stream()
                .filter(marshaller -> path.endsWith("." + marshaller.extension()))
                .max(Comparator.comparingInt(marshaller -> marshaller.extension().length()));
    }

    /**
     * Returns a copy of the list with the given format moved to the front.
     */
    public static List<Marshaller> preferring(final Marshaller preferred, final List<Marshaller> marshallers) {
        final List<Marshaller> ordered = new ArrayList<>(marshallers.size() + 1);
        ordered.add(preferred);
        marshallers.stream()
                .filter(marshaller -> marshaller != preferred)
                .forEach(ordered::add);
        return List.copyOf(ordered);
    }
}
