package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;

import java.time.Instant;

/**
 * Outcome of a rotation. {@code newSecret} is returned once and never stored.
 */
public record RotationResult(
        ApiKeyRecord newRecord,
        String newSecret,
        String oldKeyId,
        Instant oldValidUntil,
        RotationTrigger trigger
) {

    @Override
    public String toString() {
        return "RotationResult[old=" + oldKeyId + ", new=" + newRecord.getKeyId()
                + ", oldValidUntil=" + oldValidUntil + ", trigger=" + trigger + "]";
    }
}
