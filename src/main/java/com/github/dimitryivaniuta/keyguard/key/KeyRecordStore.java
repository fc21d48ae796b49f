package com.github.dimitryivaniuta.keyguard.key;

import java.util.List;
import java.util.Optional;

/**
 * Key-value view of the key records owned by the persistence layer.
 *
 * <p>Implementations signal infrastructure faults (timeouts, lost connections) with
 * {@link com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException}.
 */
public interface KeyRecordStore {

    Optional<ApiKeyRecord> get(String keyId);

    /**
     * Replaces {@code expected} with {@code replacement} only if the stored record still equals
     * {@code expected}.
     *
     * @return false when the stored record changed (or vanished) in the meantime
     */
    boolean compareAndSwap(String keyId, ApiKeyRecord expected, ApiKeyRecord replacement);

    void put(ApiKeyRecord record);

    /** Full scan for bookkeeping jobs. Not used on the request path. */
    List<ApiKeyRecord> findAll();
}
