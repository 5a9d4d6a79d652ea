package configstore.domain.factory.config;

import configstore.domain.exceptions.ConfigUsageError;
import io.vavr.control.Try;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.Optional;

/**
 * Reads numeric properties. A blank or missing value means the default, anything else must parse.
 */
final class NumberProperty {
    private NumberProperty() {
    }

    static int toInt(final String name, final Optional<String> value, final int defaultValue) {
        return value
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .map(trimmed -> Try.of(() -> NumberUtils.createInteger(trimmed))
                        .getOrElseThrow(ex -> new ConfigUsageError("Invalid integer for " + name + ": " + trimmed, ex)))
                .orElse(defaultValue);
    }

    static long toLong(final String name, final Optional<String> value, final long defaultValue) {
        return value
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .map(trimmed -> Try.of(() -> NumberUtils.createLong(trimmed))
                        .getOrElseThrow(ex -> new ConfigUsageError("Invalid integer for " + name + ": " + trimmed, ex)))
                .orElse(defaultValue);
    }
}
