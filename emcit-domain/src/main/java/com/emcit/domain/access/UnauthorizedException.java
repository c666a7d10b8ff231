package com.emcit.domain.access;

import com.emcit.domain.DomainException;

public final class UnauthorizedException extends DomainException {

    public UnauthorizedException() {
        super("Unauthorized");
    }
}
