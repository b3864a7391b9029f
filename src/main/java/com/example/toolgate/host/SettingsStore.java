package com.example.toolgate.host;

import java.util.Optional;

public interface SettingsStore {

    Optional<String> get(SettingKey key);

    /**
     * Stores {@code value} after normalizing it to the key's type. A {@code null} or empty value
     * clears the setting.
     *
     * @throws IllegalArgumentException if the value does not fit the key's type
     */
    void set(SettingKey key, String value);

    default String getString(SettingKey key) {
        return get(key).orElse("");
    }

    default int getInt(SettingKey key, int fallback) {
        return get(key).map(Integer::parseInt).orElse(fallback);
    }
}
