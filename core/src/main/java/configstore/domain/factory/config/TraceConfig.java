package configstore.domain.factory.config;

import configstore.domain.trace.TraceSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class TraceConfig {
    @Inject
    @ConfigProperty(name = "cs.trace.enabled", defaultValue = "false")
    private String enabled;

    @Inject
    @ConfigProperty(name = "cs.trace.responses", defaultValue = "false")
    private String responses;

    @Inject
    @ConfigProperty(name = "cs.trace.include")
    private Optional<String> include;

    @Inject
    @ConfigProperty(name = "cs.trace.exclude")
    private Optional<String> exclude;

    public TraceSettings getSettings() {
        return new TraceSettings(
                Boolean.parseBoolean(enabled),
                Boolean.parseBoolean(responses),
                prefixes(include),
                prefixes(exclude));
    }

    private static List<String> prefixes(final Optional<String> value) {
        return value.map(list -> Arrays.stream(list.split(","))
                        .map(String::trim)
                        .filter(StringUtils::isNotBlank)
                        .toList())
                .orElse(List.of());
    }
}
