package configstore.domain.store;

import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshaller;

/**
 * A logical name plus an explicit format, bypassing the store's format resolution.
 */
public record FormatKey(String key, Marshaller format) implements Descriptor {
    public FormatKey {
        if (key == null) {
            throw new ConfigUsageError("FormatKey must be passed a non-null name");
        }
        if (format == null) {
            throw new ConfigUsageError("FormatKey must be passed a non-null format for key " + key);
        }
    }

    @Override
    public String toString() {
        return key + " (" + format.name() + ")";
    }
}
