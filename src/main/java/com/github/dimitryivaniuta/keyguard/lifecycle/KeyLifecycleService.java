package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.clock.TimeSource;
import com.github.dimitryivaniuta.keyguard.config.KeyGuardProperties;
import com.github.dimitryivaniuta.keyguard.credential.CredentialCodec;
import com.github.dimitryivaniuta.keyguard.credential.KeyPair;
import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyRecordStore;
import com.github.dimitryivaniuta.keyguard.key.KeyStatus;
import com.github.dimitryivaniuta.keyguard.metrics.KeyGuardMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Administrative key operations: issue, rotate, revoke, enable/disable, extend.
 *
 * <p>Every mutation is a compare-and-swap on the stored record; a lost race is retried from a fresh read
 * (rotation is never retried, see {@link #rotate}).
 */
@Slf4j
@Service
public class KeyLifecycleService {

    /** Minimum lifetime given to a rotated key when the old one had an expiry. */
    private static final Duration MIN_ROTATED_VALIDITY = Duration.ofDays(30);

    private final KeyRecordStore store;
    private final CredentialCodec codec;
    private final KeyLifecycle lifecycle;
    private final TimeSource time;
    private final KeyGuardMetrics metrics;
    private final KeyGuardProperties.Lifecycle config;

    public KeyLifecycleService(KeyRecordStore store,
                               CredentialCodec codec,
                               KeyLifecycle lifecycle,
                               TimeSource time,
                               KeyGuardMetrics metrics,
                               KeyGuardProperties properties) {
        this.store = store;
        this.codec = codec;
        this.lifecycle = lifecycle;
        this.time = time;
        this.metrics = metrics;
        this.config = properties.getLifecycle();
    }

    public IssuedKey issue(IssueKeyCommand cmd) {
        Instant now = time.now();
        if (cmd.rateLimitOverride() != null && cmd.rateLimitOverride() <= 0) {
            throw new IllegalArgumentException("rateLimitOverride must be > 0");
        }
        if (cmd.validity() != null) {
            if (cmd.validity().isNegative() || cmd.validity().isZero()) {
                throw new IllegalArgumentException("validity must be positive");
            }
            if (cmd.validity().compareTo(Duration.ofDays(config.getMaxExpirationDays())) > 0) {
                throw new IllegalArgumentException("validity exceeds " + config.getMaxExpirationDays() + " days");
            }
        }
        for (String entry : cmd.ipAllowList()) {
            if (!lifecycle.ipMatcher().isValidEntry(entry)) {
                throw new IllegalArgumentException("Invalid IP allow-list entry: " + entry);
            }
        }

        KeyPair pair = codec.generateKeyPair();
        ApiKeyRecord record = ApiKeyRecord.builder()
                .keyId(pair.keyId())
                .secretHash(pair.secretHash())
                .name(cmd.name())
                .ownerId(cmd.ownerId())
                .status(KeyStatus.ACTIVE)
                .scopes(cmd.scopes())
                .rateLimitOverride(cmd.rateLimitOverride())
                .createdAt(now)
                .expiresAt(cmd.validity() == null ? null : now.plus(cmd.validity()))
                .ipAllowList(cmd.ipAllowList())
                .build();
        store.put(record);
        metrics.keyTransition(KeyStatus.ACTIVE.name());
        log.info("Issued API key {} for owner {}", record.getKeyId(), record.getOwnerId());
        return new IssuedKey(record, pair.secret());
    }

    /**
     * Replaces a key with a fresh one. The old record gets {@code replacedBy} and an expiry at the end of the
     * grace period in one compare-and-swap, so two concurrent rotations of the same key cannot both succeed.
     * A lost compare-and-swap (typically a {@code lastUsedAt} update from live traffic) is retried on a fresh
     * read, which re-runs every check; a key rotated in the meantime fails with {@link KeyConflictException}.
     *
     * @param gracePeriod overlap during which the old key still validates; {@code null} for the trigger default
     * @throws KeyConflictException if the key was rotated concurrently or kept changing for every attempt
     */
    public RotationResult rotate(String keyId, RotationTrigger trigger, Duration gracePeriod) {
        if (gracePeriod != null && gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
        Duration grace = trigger.immediateRevocation()
                ? Duration.ZERO
                : (gracePeriod != null ? gracePeriod : trigger.defaultGracePeriod());
        KeyPair pair = codec.generateKeyPair();

        int attempts = Math.max(1, config.getMaxCasAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Instant now = time.now();
            ApiKeyRecord old = find(keyId);
            if (old.isRotated()) {
                throw new KeyConflictException("API key " + keyId + " was already rotated to " + old.getReplacedBy());
            }
            if (lifecycle.effectiveStatus(old, now) != KeyStatus.ACTIVE) {
                throw new IllegalKeyTransitionException(keyId, "only active keys can be rotated");
            }

            Instant oldValidUntil = now.plus(grace);
            if (old.getExpiresAt() != null && old.getExpiresAt().isBefore(oldValidUntil)) {
                oldValidUntil = old.getExpiresAt();
            }
            ApiKeyRecord.ApiKeyRecordBuilder retired = old.next()
                    .replacedBy(pair.keyId())
                    .expiresAt(oldValidUntil);
            if (trigger.immediateRevocation()) {
                retired.status(KeyStatus.REVOKED);
            }

            if (store.compareAndSwap(keyId, old, retired.build())) {
                ApiKeyRecord successor = successorOf(old, pair, now);
                try {
                    store.put(successor);
                } catch (RuntimeException ex) {
                    log.error("Rotation of {} committed but successor {} was not stored", keyId, successor.getKeyId(), ex);
                    throw ex;
                }
                metrics.keyRotated(trigger.name());
                log.info("Rotated API key {} -> {} (trigger={}, old valid until {})",
                        keyId, successor.getKeyId(), trigger, oldValidUntil);
                return new RotationResult(successor, pair.secret(), keyId, oldValidUntil, trigger);
            }
            log.debug("CAS conflict while rotating API key {} (attempt {}/{})", keyId, attempt, attempts);
        }
        throw new KeyConflictException("API key " + keyId + " changed during rotation");
    }

    private static ApiKeyRecord successorOf(ApiKeyRecord old, KeyPair pair, Instant now) {
        return ApiKeyRecord.builder()
                .keyId(pair.keyId())
                .secretHash(pair.secretHash())
                .name(old.getName())
                .ownerId(old.getOwnerId())
                .status(KeyStatus.ACTIVE)
                .scopes(old.getScopes())
                .rateLimitOverride(old.getRateLimitOverride())
                .createdAt(now)
                .expiresAt(rotatedExpiry(old, now))
                .ipAllowList(old.getIpAllowList())
                .replaces(old.getKeyId())
                .build();
    }

    public ApiKeyRecord revoke(String keyId) {
        ApiKeyRecord updated = mutate(keyId, current -> {
            if (current.getStatus() == KeyStatus.REVOKED) {
                return current;
            }
            requireTransition(current, KeyStatus.REVOKED);
            return current.next().status(KeyStatus.REVOKED).build();
        });
        metrics.keyTransition(KeyStatus.REVOKED.name());
        log.info("Revoked API key {}", keyId);
        return updated;
    }

    /** Toggles between ACTIVE and INACTIVE. Terminal keys are refused. */
    public ApiKeyRecord setEnabled(String keyId, boolean enabled) {
        KeyStatus target = enabled ? KeyStatus.ACTIVE : KeyStatus.INACTIVE;
        ApiKeyRecord updated = mutate(keyId, current -> {
            if (current.getStatus() == target) {
                return current;
            }
            requireTransition(current, target);
            return current.next().status(target).build();
        });
        metrics.keyTransition(target.name());
        log.info("API key {} is now {}", keyId, target);
        return updated;
    }

    /**
     * Pushes the expiry out by {@code additionalDays}, capped at {@code max-expiration-days} from now.
     * Expired and revoked keys cannot be revived.
     */
    public ApiKeyRecord extendExpiration(String keyId, int additionalDays) {
        if (additionalDays <= 0 || additionalDays > config.getMaxExpirationDays()) {
            throw new IllegalArgumentException(
                    "additionalDays must be between 1 and " + config.getMaxExpirationDays());
        }
        Instant now = time.now();
        Instant cap = now.plus(Duration.ofDays(config.getMaxExpirationDays()));
        ApiKeyRecord updated = mutate(keyId, current -> {
            KeyStatus effective = lifecycle.effectiveStatus(current, now);
            if (effective.isTerminal()) {
                throw new IllegalKeyTransitionException(keyId, "cannot extend a key that is " + effective);
            }
            Instant base = current.getExpiresAt() != null ? current.getExpiresAt() : now;
            Instant extended = base.plus(Duration.ofDays(additionalDays));
            if (extended.isAfter(cap)) {
                extended = cap;
            }
            return current.next().expiresAt(extended).build();
        });
        log.info("Extended API key {} until {}", keyId, updated.getExpiresAt());
        return updated;
    }

    public KeyLifecycleReport report(String keyId) {
        Instant now = time.now();
        ApiKeyRecord record = find(keyId);
        LifecycleStatus status = lifecycle.lifecycleStatus(record, now);
        Long days = record.getExpiresAt() == null ? null : Duration.between(now, record.getExpiresAt()).toDays();
        return new KeyLifecycleReport(
                record.getKeyId(),
                status,
                record.getStatus(),
                record.getCreatedAt(),
                record.getExpiresAt(),
                record.getLastUsedAt(),
                days,
                record.getReplacedBy(),
                record.getReplaces(),
                recommendations(record, status));
    }

    public List<ApiKeyRecord> list() {
        List<ApiKeyRecord> all = new ArrayList<>(store.findAll());
        all.sort(Comparator.comparing(ApiKeyRecord::getCreatedAt));
        return all;
    }

    private ApiKeyRecord find(String keyId) {
        return store.get(keyId).orElseThrow(() -> new UnknownKeyException(keyId));
    }

    private ApiKeyRecord mutate(String keyId, UnaryOperator<ApiKeyRecord> change) {
        int attempts = Math.max(1, config.getMaxCasAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ApiKeyRecord current = find(keyId);
            ApiKeyRecord updated = change.apply(current);
            if (updated == current) {
                return current;
            }
            if (store.compareAndSwap(keyId, current, updated)) {
                return updated;
            }
            log.debug("CAS conflict on API key {} (attempt {}/{})", keyId, attempt, attempts);
        }
        throw new KeyConflictException("API key " + keyId + " is being modified concurrently");
    }

    private static void requireTransition(ApiKeyRecord current, KeyStatus target) {
        if (!current.getStatus().canTransitionTo(target)) {
            throw new IllegalKeyTransitionException(current.getKeyId(),
                    "cannot move from " + current.getStatus() + " to " + target);
        }
    }

    private static Instant rotatedExpiry(ApiKeyRecord old, Instant now) {
        if (old.getExpiresAt() == null) {
            return null;
        }
        Duration remaining = Duration.between(now, old.getExpiresAt());
        return now.plus(remaining.compareTo(MIN_ROTATED_VALIDITY) > 0 ? remaining : MIN_ROTATED_VALIDITY);
    }

    private static List<String> recommendations(ApiKeyRecord record, LifecycleStatus status) {
        List<String> out = new ArrayList<>();
        switch (status) {
            case EXPIRING_SOON -> out.add("Rotate the key before it expires to avoid service interruption");
            case ROTATING -> out.add("Move clients to " + record.getReplacedBy() + " before the grace period ends");
            case EXPIRED, REVOKED -> out.add("Issue a new key and update client configuration");
            case ACTIVE -> {
                if (record.getExpiresAt() == null) {
                    out.add("Consider setting an expiration date");
                }
            }
            case INACTIVE -> out.add("Re-enable the key or revoke it if it is no longer needed");
        }
        if (record.hasScope("admin")) {
            out.add("Review admin permissions regularly");
        }
        if (record.getIpAllowList().isEmpty() && !status.equals(LifecycleStatus.REVOKED)) {
            out.add("Consider restricting the key to known IP addresses");
        }
        return List.copyOf(out);
    }
}
