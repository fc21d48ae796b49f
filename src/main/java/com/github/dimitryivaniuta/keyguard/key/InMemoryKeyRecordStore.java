package com.github.dimitryivaniuta.keyguard.key;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryKeyRecordStore implements KeyRecordStore {

    private final ConcurrentMap<String, ApiKeyRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ApiKeyRecord> get(String keyId) {
        if (keyId == null) return Optional.empty();
        return Optional.ofNullable(records.get(keyId));
    }

    @Override
    public boolean compareAndSwap(String keyId, ApiKeyRecord expected, ApiKeyRecord replacement) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (!keyId.equals(replacement.getKeyId())) {
            throw new IllegalArgumentException("replacement keyId does not match " + keyId);
        }
        return records.replace(keyId, expected, replacement);
    }

    @Override
    public void put(ApiKeyRecord record) {
        records.put(record.getKeyId(), record);
    }

    @Override
    public List<ApiKeyRecord> findAll() {
        return List.copyOf(records.values());
    }
}
