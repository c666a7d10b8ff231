package com.emcit.domain.crypto;

import com.emcit.domain.DomainException;

/**
 * A token could not be opened: malformed, produced under another key, or tampered with.
 * The message never carries token contents.
 */
public final class DecryptionException extends DomainException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
