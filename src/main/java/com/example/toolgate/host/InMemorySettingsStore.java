package com.example.toolgate.host;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySettingsStore implements SettingsStore {

    private final Map<SettingKey, String> values = new ConcurrentHashMap<>();

    public InMemorySettingsStore() {
        for (SettingKey key : SettingKey.values()) {
            if (key.defaultValue() != null) {
                values.put(key, key.defaultValue());
            }
        }
    }

    @Override
    public Optional<String> get(SettingKey key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(SettingKey key, String value) {
        if (value == null || value.isEmpty()) {
            values.remove(key);
            return;
        }
        values.put(key, key.type().normalize(value));
    }
}
