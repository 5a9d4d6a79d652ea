package configstore.domain.store;

import configstore.domain.exceptions.ConfigUsageError;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The namespace a store is confined to: an application name followed by any number of sub namespaces. Two scopes
 * never see each other's entries, even when they share one physical backend.
 *
 * @param app       The application name
 * @param namespace The sub namespaces, outermost first
 */
public record Scope(String app, List<String> namespace) {
    public static final String SEPARATOR = "/";

    public Scope {
        validateSegment(app);
        if (namespace == null) {
            namespace = List.of();
        }
        namespace.forEach(Scope::validateSegment);
        namespace = List.copyOf(namespace);
    }

    public static Scope of(final String app, final String... namespace) {
        return new Scope(app, namespace == null ? List.of() : Arrays.asList(namespace));
    }

    /**
     * The application name followed by the namespaces.
     */
    public List<String> segments() {
        final List<String> segments = new ArrayList<>(namespace.size() + 1);
        segments.add(app);
        segments.addAll(namespace);
        return segments;
    }

    /**
     * The segments joined with "/", e.g. "app/sub1/sub2". Relational and key-value backends use this as the scope
     * column or bucket name.
     */
    public String path() {
        return String.join(SEPARATOR, segments());
    }

    @Override
    public String toString() {
        return path();
    }

    private static void validateSegment(final String segment) {
        if (StringUtils.isBlank(segment)) {
            throw new ConfigUsageError("Scope segments must not be blank");
        }
        if (segment.contains(SEPARATOR) || segment.equals(".") || segment.equals("..")) {
            throw new ConfigUsageError("Invalid scope segment: " + segment);
        }
    }
}
