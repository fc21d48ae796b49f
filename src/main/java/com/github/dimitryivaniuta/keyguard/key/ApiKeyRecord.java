package com.github.dimitryivaniuta.keyguard.key;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Immutable snapshot of a stored API key.
 *
 * <p>Mutations produce a new snapshot with {@code version + 1} via {@link #next()}; stores compare whole
 * snapshots on compare-and-swap, so a stale snapshot never overwrites a newer one.
 */
@Value
@Builder(toBuilder = true)
public class ApiKeyRecord {

    @NonNull String keyId;

    /** HMAC of the secret. The secret itself is never stored. */
    @NonNull String secretHash;

    String name;

    /** Owning user; identifier of the per-user rate limit scope. */
    String ownerId;

    @NonNull @Builder.Default KeyStatus status = KeyStatus.ACTIVE;

    @NonNull @Builder.Default Set<String> scopes = Set.of();

    /** Authoritative capacity for per-key rules when present. */
    Integer rateLimitOverride;

    @NonNull Instant createdAt;

    Instant expiresAt;

    Instant lastUsedAt;

    @NonNull @Builder.Default Set<String> ipAllowList = Set.of();

    /** Successor key id once this key has been rotated. */
    String replacedBy;

    /** Predecessor key id when this key was created by rotation. */
    String replaces;

    @Builder.Default long version = 0L;

    public boolean isExpiredAt(Instant now) {
        return status == KeyStatus.EXPIRED || (expiresAt != null && now.isAfter(expiresAt));
    }

    public boolean isRotated() {
        return replacedBy != null;
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    /** Builder seeded from this snapshot with the version already bumped. */
    public ApiKeyRecordBuilder next() {
        return toBuilder().version(version + 1);
    }

    @Override
    public String toString() {
        return "ApiKeyRecord[keyId=" + keyId + ", status=" + status + ", version=" + version + "]";
    }
}
