package com.github.dimitryivaniuta.keyguard.key;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKeyRecordStoreTest {

    private final InMemoryKeyRecordStore store = new InMemoryKeyRecordStore();

    private static ApiKeyRecord record(String keyId) {
        return ApiKeyRecord.builder()
                .keyId(keyId)
                .secretHash("hash")
                .name("test")
                .ownerId("owner")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void compareAndSwapSucceedsOnlyAgainstCurrentSnapshot() {
        ApiKeyRecord v0 = record("ak_1");
        store.put(v0);

        ApiKeyRecord v1 = v0.next().status(KeyStatus.INACTIVE).build();
        assertThat(store.compareAndSwap("ak_1", v0, v1)).isTrue();

        ApiKeyRecord stale = v0.next().status(KeyStatus.REVOKED).build();
        assertThat(store.compareAndSwap("ak_1", v0, stale)).isFalse();
        assertThat(store.get("ak_1")).contains(v1);
        assertThat(v1.getVersion()).isEqualTo(1L);
    }

    @Test
    void compareAndSwapOnMissingKeyFails() {
        ApiKeyRecord v0 = record("ak_missing");
        assertThat(store.compareAndSwap("ak_missing", v0, v0.next().build())).isFalse();
        assertThat(store.get("ak_missing")).isEmpty();
    }

    @Test
    void replacementMustKeepKeyId() {
        ApiKeyRecord v0 = record("ak_1");
        store.put(v0);
        assertThatThrownBy(() -> store.compareAndSwap("ak_1", v0, record("ak_2")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookupOfNullKeyIdIsEmpty() {
        assertThat(store.get(null)).isEmpty();
    }

    @Test
    void findAllReturnsSnapshot() {
        store.put(record("ak_1"));
        store.put(record("ak_2"));
        assertThat(store.findAll()).extracting(ApiKeyRecord::getKeyId).containsExactlyInAnyOrder("ak_1", "ak_2");
    }
}
