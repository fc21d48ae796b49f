package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;
import com.github.dimitryivaniuta.keyguard.key.KeyStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeyLifecycleTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final KeyLifecycle lifecycle = new KeyLifecycle(new IpAllowListMatcher(), Duration.ofDays(7));

    private static ApiKeyRecord.ApiKeyRecordBuilder key() {
        return ApiKeyRecord.builder()
                .keyId("ak_1")
                .secretHash("h")
                .name("n")
                .ownerId("o")
                .createdAt(T0);
    }

    @Test
    void activeKeyWithoutRestrictionsIsAllowed() {
        assertThat(lifecycle.check(key().build(), T0, "10.0.0.1").allowed()).isTrue();
        assertThat(lifecycle.check(key().build(), T0, null).allowed()).isTrue();
    }

    @Test
    void revokedKeyIsDeniedForAnyClockValue() {
        ApiKeyRecord revoked = key().status(KeyStatus.REVOKED).expiresAt(T0.plus(Duration.ofDays(30))).build();

        for (Instant t : new Instant[]{Instant.EPOCH, T0.minusSeconds(1), T0, T0.plus(Duration.ofDays(3650))}) {
            LifecycleVerdict v = lifecycle.check(revoked, t, "10.0.0.1");
            assertThat(v.allowed()).isFalse();
            assertThat(v.denial()).isEqualTo(LifecycleDenial.REVOKED);
        }
    }

    @Test
    void expiryIsDerivedAtCheckTime() {
        ApiKeyRecord expiring = key().expiresAt(T0.plusSeconds(60)).build();

        assertThat(lifecycle.check(expiring, T0.plusSeconds(60), null).allowed()).isTrue();
        assertThat(lifecycle.check(expiring, T0.plusSeconds(61), null).denial()).isEqualTo(LifecycleDenial.EXPIRED);
        assertThat(lifecycle.effectiveStatus(expiring, T0.plusSeconds(61))).isEqualTo(KeyStatus.EXPIRED);
        assertThat(expiring.getStatus()).isEqualTo(KeyStatus.ACTIVE);
    }

    @Test
    void inactiveKeyIsDenied() {
        assertThat(lifecycle.check(key().status(KeyStatus.INACTIVE).build(), T0, null).denial())
                .isEqualTo(LifecycleDenial.INACTIVE);
    }

    @Test
    void ipAllowListSupportsAddressesAndCidrBlocks() {
        ApiKeyRecord restricted = key().ipAllowList(Set.of("192.168.1.0/24", "10.1.2.3", "2001:db8::/32")).build();

        assertThat(lifecycle.check(restricted, T0, "192.168.1.77").allowed()).isTrue();
        assertThat(lifecycle.check(restricted, T0, "10.1.2.3").allowed()).isTrue();
        assertThat(lifecycle.check(restricted, T0, "2001:db8::1").allowed()).isTrue();

        assertThat(lifecycle.check(restricted, T0, "192.168.2.1").denial()).isEqualTo(LifecycleDenial.IP_RESTRICTED);
        assertThat(lifecycle.check(restricted, T0, "10.1.2.4").denial()).isEqualTo(LifecycleDenial.IP_RESTRICTED);
        assertThat(lifecycle.check(restricted, T0, null).denial()).isEqualTo(LifecycleDenial.IP_RESTRICTED);
    }

    @Test
    void lifecycleStatusReflectsExpiryWindowAndRotation() {
        assertThat(lifecycle.lifecycleStatus(key().build(), T0)).isEqualTo(LifecycleStatus.ACTIVE);
        assertThat(lifecycle.lifecycleStatus(key().expiresAt(T0.plus(Duration.ofDays(3))).build(), T0))
                .isEqualTo(LifecycleStatus.EXPIRING_SOON);
        assertThat(lifecycle.lifecycleStatus(key().expiresAt(T0.plus(Duration.ofDays(30))).build(), T0))
                .isEqualTo(LifecycleStatus.ACTIVE);
        assertThat(lifecycle.lifecycleStatus(key().replacedBy("ak_2").expiresAt(T0.plus(Duration.ofDays(3))).build(), T0))
                .isEqualTo(LifecycleStatus.ROTATING);
        assertThat(lifecycle.lifecycleStatus(key().expiresAt(T0.minusSeconds(1)).build(), T0))
                .isEqualTo(LifecycleStatus.EXPIRED);
    }
}
