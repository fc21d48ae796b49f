package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.key.KeyStatus;
import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Persists statuses that are already in effect: expired keys become EXPIRED, rotated keys past their grace
 * period become REVOKED. Validation does not depend on this job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "key-guard.lifecycle", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class KeyExpirationSweeper {

    private final KeyRecordStore store;
    private final TimeSource time;
    private final KeyGuardMetrics metrics;

    @Scheduled(cron = "${key-guard.lifecycle.sweep-cron:0 */5 * * * *}")
    public void scheduledSweep() {
        try {
            int n = sweep();
            if (n > 0) {
                log.info("Key sweep updated {} record(s)", n);
            }
        } catch (StoreUnavailableException ex) {
            metrics.storeFailure("sweep");
            log.warn("Key sweep skipped, store unavailable: {}", ex.getMessage());
        }
    }

    public int sweep() {
        Instant now = time.now();
        int updated = 0;
        for (ApiKeyRecord record : store.findAll()) {
            if (record.getStatus().isTerminal() || !record.isExpiredAt(now)) {
                continue;
            }
            KeyStatus target = record.isRotated() ? KeyStatus.REVOKED : KeyStatus.EXPIRED;
            if (store.compareAndSwap(record.getKeyId(), record, record.next().status(target).build())) {
                metrics.keyTransition(target.name());
                updated++;
            } else {
                log.debug("Key {} changed during sweep, leaving it for the next run", record.getKeyId());
            }
        }
        return updated;
    }
}
