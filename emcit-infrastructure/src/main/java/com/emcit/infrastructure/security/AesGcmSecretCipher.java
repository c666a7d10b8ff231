package com.emcit.infrastructure.security;

import com.emcit.application.ports.CryptoPort;
import com.emcit.domain.crypto.DecryptionException;
import com.emcit.domain.crypto.EncryptionConfigException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-GCM encryption for secrets under one process-wide key.
 *
 * Format: v1:base64(iv(12)):base64(ciphertext+tag)
 *
 * There is no key id in the payload: a payload produced under a rotated key cannot be opened.
 */
public final class AesGcmSecretCipher implements CryptoPort {

    static final String VERSION = "v1";
    static final int KEY_LEN = 32;

    private static final int IV_LEN = 12;
    private static final int TAG_BITS = 128;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private static final SecureRandom RNG = new SecureRandom();

    private final SecretKey key;

    public AesGcmSecretCipher(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != KEY_LEN) {
            throw new EncryptionConfigException(
                    "Encryption key must be " + KEY_LEN + " bytes, got " + (keyBytes == null ? 0 : keyBytes.length));
        }
        this.key = new SecretKeySpec(keyBytes.clone(), "AES");
    }

    /**
     * Builds the cipher from a base64 key (standard or URL-safe alphabet).
     *
     * @throws EncryptionConfigException if the key is absent, not base64, or not 32 bytes
     */
    public static AesGcmSecretCipher fromBase64Key(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new EncryptionConfigException(
                    "FATAL: encryption key is missing. Set EMCIT_ENCRYPTION_KEY (32 random bytes, base64).");
        }
        return new AesGcmSecretCipher(decodeKey(base64Key.trim()));
    }

    private static byte[] decodeKey(String s) {
        try {
            return Base64.getDecoder().decode(s);
        } catch (IllegalArgumentException notStandard) {
            try {
                return Base64.getUrlDecoder().decode(s);
            } catch (IllegalArgumentException e) {
                throw new EncryptionConfigException("FATAL: encryption key is not valid base64", e);
            }
        }
    }

    @Override
    public String encryptToPayload(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            byte[] iv = new byte[IV_LEN];
            RNG.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] ct = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            Base64.Encoder b64 = Base64.getEncoder();
            return VERSION + ":" + b64.encodeToString(iv) + ":" + b64.encodeToString(ct);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt secret", e);
        }
    }

    @Override
    public String decryptPayload(String payload) {
        if (payload == null || payload.isEmpty()) {
            throw new DecryptionException("Encrypted payload is empty");
        }
        String[] parts = payload.split(":", -1);
        if (parts.length != 3 || !VERSION.equals(parts[0])) {
            throw new DecryptionException("Unsupported payload format");
        }

        byte[] iv = decodeCanonical(parts[1]);
        byte[] ct = decodeCanonical(parts[2]);
        if (iv.length != IV_LEN || ct.length < TAG_BITS / 8) {
            throw new DecryptionException("Encrypted payload too short");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] pt = cipher.doFinal(ct);
            return new String(pt, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt secret (wrong key or corrupted data)", e);
        }
    }

    // Base64 decoding ignores unused trailing bits; re-encoding rejects such variants.
    private static byte[] decodeCanonical(String part) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(part);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted payload is not valid base64", e);
        }
        if (!Base64.getEncoder().encodeToString(bytes).equals(part)) {
            throw new DecryptionException("Encrypted payload is not canonical base64");
        }
        return bytes;
    }
}
