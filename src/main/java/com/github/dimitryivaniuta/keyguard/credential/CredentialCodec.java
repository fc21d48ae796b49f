package com.github.dimitryivaniuta.keyguard.credential;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generates key pairs and hashes/verifies secrets with HMAC-SHA256 under a server-held signing key.
 *
 * <p>Secrets are never logged. Every verification path (including malformed input and unknown key ids)
 * performs exactly one HMAC and one constant-time comparison.
 */
public class CredentialCodec {

    public static final String KEY_ID_PREFIX = "ak_";
    public static final String SECRET_PREFIX = "sk_";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int KEY_ID_BYTES = 16;
    private static final int SECRET_BYTES = 32; // 256-bit
    private static final int MIN_SIGNING_KEY_LENGTH = 32;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    private final byte[] signingKey;
    private final int maxSecretLength;
    private final String placeholderSecret;
    private final String dummyHash;

    public CredentialCodec(String signingKey, int maxSecretLength) {
        if (signingKey == null || signingKey.length() < MIN_SIGNING_KEY_LENGTH) {
            throw new IllegalStateException(
                    "key-guard.credential.signing-key must be at least " + MIN_SIGNING_KEY_LENGTH + " characters");
        }
        if (maxSecretLength < 16) {
            throw new IllegalStateException("key-guard.credential.max-secret-length must be >= 16");
        }
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        this.maxSecretLength = maxSecretLength;
        this.placeholderSecret = SECRET_PREFIX + randomToken(SECRET_BYTES);
        this.dummyHash = hash(SECRET_PREFIX + randomToken(SECRET_BYTES));
    }

    /** Generates a prefixed public id and a 256-bit secret. Store ONLY the returned hash. */
    public KeyPair generateKeyPair() {
        String keyId = KEY_ID_PREFIX + randomToken(KEY_ID_BYTES);
        String secret = SECRET_PREFIX + randomToken(SECRET_BYTES);
        return new KeyPair(keyId, secret, hash(secret));
    }

    /** HMAC-SHA256 of the secret, lowercase hex. Deterministic for a given signing key. */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to hash API key secret", e);
        }
    }

    /**
     * Recomputes the hash of {@code presentedSecret} and compares it with {@code storedHash} in constant time.
     * Malformed secrets are compared against a dummy hash instead, so they cost the same as a mismatch.
     */
    public boolean verify(String presentedSecret, String storedHash) {
        boolean wellFormed = isWellFormed(presentedSecret) && storedHash != null && !storedHash.isEmpty();
        String candidate = hash(wellFormed ? presentedSecret : placeholderSecret);
        String expected = wellFormed ? storedHash : dummyHash;
        boolean equal = constantTimeEquals(candidate, expected);
        return wellFormed && equal;
    }

    /** Same work as {@link #verify} for a key id that does not exist. Always false. */
    public boolean verifyAbsent(String presentedSecret) {
        String candidate = hash(isWellFormed(presentedSecret) ? presentedSecret : placeholderSecret);
        constantTimeEquals(candidate, dummyHash);
        return false;
    }

    public boolean isWellFormed(String secret) {
        return secret != null
                && !secret.isBlank()
                && secret.length() <= maxSecretLength
                && secret.startsWith(SECRET_PREFIX)
                && secret.length() > SECRET_PREFIX.length();
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.US_ASCII),
                b.getBytes(StandardCharsets.US_ASCII));
    }

    private String randomToken(int bytes) {
        byte[] buf = new byte[bytes];
        secureRandom.nextBytes(buf);
        return encoder.encodeToString(buf);
    }
}
