package configstore.domain.store;

import configstore.domain.exceptions.ConfigUsageError;

/**
 * A bare logical name. Stores resolve the format on their own.
 */
public record Key(String key) implements Descriptor {
    public Key {
        if (key == null) {
            throw new ConfigUsageError("Key must be passed a non-null name");
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
