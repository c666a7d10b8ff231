package com.emcit.application.ports;

/**
 * Reversible, authenticated encryption of short secrets under the process-wide key.
 */
public interface CryptoPort {

    /** Encrypts plaintext and returns payload: v1:&lt;b64(iv)&gt;:&lt;b64(ciphertext)&gt; */
    String encryptToPayload(String plaintext);

    /**
     * Decrypts payload v1 and returns plaintext.
     *
     * @throws com.emcit.domain.crypto.DecryptionException if the payload is malformed,
     *         was produced under another key, or fails its integrity check
     */
    String decryptPayload(String payload);
}
