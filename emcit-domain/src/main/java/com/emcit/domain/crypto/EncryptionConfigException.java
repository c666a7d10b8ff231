package com.emcit.domain.crypto;

/**
 * Encryption key missing or malformed. Only raised while the process starts.
 */
public final class EncryptionConfigException extends IllegalStateException {

    public EncryptionConfigException(String message) {
        super(message);
    }

    public EncryptionConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
