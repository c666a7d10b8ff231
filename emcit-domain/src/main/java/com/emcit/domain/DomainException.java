package com.emcit.domain;

/**
 * Base type for business rule violations raised by the core.
 * The API layer maps concrete subtypes to stable error bodies.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
