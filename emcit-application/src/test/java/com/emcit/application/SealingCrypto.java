package com.emcit.application;

import com.emcit.application.ports.CryptoPort;
import com.emcit.domain.crypto.DecryptionException;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reversible stand-in for the real cipher. Tokens are tagged with a key name so that tokens
 * from a differently keyed instance fail to open.
 */
public final class SealingCrypto implements CryptoPort {

    private final String keyName;
    public final AtomicInteger decryptCalls = new AtomicInteger();

    public SealingCrypto(String keyName) {
        this.keyName = keyName;
    }

    @Override
    public String encryptToPayload(String plaintext) {
        return "sealed[" + keyName + "]:" + new StringBuilder(plaintext).reverse();
    }

    @Override
    public String decryptPayload(String payload) {
        decryptCalls.incrementAndGet();
        String prefix = "sealed[" + keyName + "]:";
        if (payload == null || !payload.startsWith(prefix)) {
            throw new DecryptionException("invalid payload");
        }
        return new StringBuilder(payload.substring(prefix.length())).reverse().toString();
    }
}
