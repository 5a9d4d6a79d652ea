package configstore.domain.trace;

import java.util.List;

/**
 * @param enabled      Log every call made to a store
 * @param logResponses Also log the values read and written. Turns tracing on by itself.
 * @param include      Only trace stores whose name starts with one of these. Empty means every store.
 * @param exclude      Never trace stores whose name starts with one of these. Wins over include.
 */
public record TraceSettings(boolean enabled, boolean logResponses, List<String> include, List<String> exclude) {
    public TraceSettings {
        include = include == null ? List.of() : List.copyOf(include);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static TraceSettings disabled() {
        return new TraceSettings(false, false, List.of(), List.of());
    }

    public boolean enabledFor(final String name) {
        if (!enabled && !logResponses) {
            return false;
        }

        if (exclude.stream().anyMatch(name::startsWith)) {
            return false;
        }

        return include.isEmpty() || include.stream().anyMatch(name::startsWith);
    }
}
