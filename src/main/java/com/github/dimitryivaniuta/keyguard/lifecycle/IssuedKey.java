package com.github.dimitryivaniuta.keyguard.lifecycle;

import com.github.dimitryivaniuta.keyguard.key.ApiKeyRecord;

/**
 * A newly issued key. {@code secret} is shown to the owner once; clients send {@code keyId.secret}.
 */
public record IssuedKey(ApiKeyRecord record, String secret) {

    public String credential() {
        return record.getKeyId() + "." + secret;
    }

    @Override
    public String toString() {
        return "IssuedKey[keyId=" + record.getKeyId() + ", secret=***]";
    }
}
