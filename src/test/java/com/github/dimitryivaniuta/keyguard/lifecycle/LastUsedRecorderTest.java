package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.InMemoryKeyRecordStore;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LastUsedRecorderTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static ApiKeyRecord key() {
        return ApiKeyRecord.builder()
                .keyId("ak_1")
                .secretHash("h")
                .name("n")
                .ownerId("o")
                .createdAt(T0)
                .build();
    }

    @Test
    void movesLastUsedForwardOnly() throws Exception {
        InMemoryKeyRecordStore store = new InMemoryKeyRecordStore();
        store.put(key());
        LastUsedRecorder recorder = new LastUsedRecorder(store, Runnable::run);

        recorder.record("ak_1", T0.plusSeconds(10)).get(5, TimeUnit.SECONDS);
        recorder.record("ak_1", T0.plusSeconds(5)).get(5, TimeUnit.SECONDS);

        ApiKeyRecord stored = store.get("ak_1").orElseThrow();
        assertThat(stored.getLastUsedAt()).isEqualTo(T0.plusSeconds(10));
        assertThat(stored.getVersion()).isZero();
    }

    @Test
    void retriesOnConflictingUpdate() throws Exception {
        KeyRecordStore store = mock(KeyRecordStore.class);
        when(store.get("ak_1")).thenReturn(Optional.of(key()));
        when(store.compareAndSwap(anyString(), any(), any())).thenReturn(false, false, true);
        LastUsedRecorder recorder = new LastUsedRecorder(store, Runnable::run);

        recorder.record("ak_1", T0).get(5, TimeUnit.SECONDS);

        verify(store, times(3)).compareAndSwap(anyString(), any(), any());
    }

    @Test
    void storeFailureIsSwallowedAfterRetries() {
        KeyRecordStore store = mock(KeyRecordStore.class);
        when(store.get("ak_1")).thenThrow(new StoreUnavailableException("down"));
        LastUsedRecorder recorder = new LastUsedRecorder(store, Runnable::run);

        assertThatCode(() -> recorder.record("ak_1", T0).get(5, TimeUnit.SECONDS)).doesNotThrowAnyException();
        verify(store, times(5)).get("ak_1");
    }

    @Test
    void unknownKeyIsIgnored() throws Exception {
        InMemoryKeyRecordStore store = new InMemoryKeyRecordStore();
        new LastUsedRecorder(store, Runnable::run).record("ak_gone", T0).get(5, TimeUnit.SECONDS);
        assertThat(store.findAll()).isEmpty();
    }

    @Test
    void saturatedExecutorDropsTheUpdate() {
        InMemoryKeyRecordStore store = new InMemoryKeyRecordStore();
        store.put(key());
        LastUsedRecorder recorder = new LastUsedRecorder(store, r -> {
            throw new RejectedExecutionException("full");
        });

        assertThatCode(() -> recorder.record("ak_1", T0).get(5, TimeUnit.SECONDS)).doesNotThrowAnyException();
        assertThat(store.get("ak_1").orElseThrow().getLastUsedAt()).isNull();
    }
}
