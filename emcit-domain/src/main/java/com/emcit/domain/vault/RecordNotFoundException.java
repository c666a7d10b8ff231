package com.emcit.domain.vault;

import com.emcit.domain.DomainException;

public final class RecordNotFoundException extends DomainException {

    private final String target;

    public RecordNotFoundException(String target) {
        super("Not Found");
        this.target = target;
    }

    public String target() {
        return target;
    }
}
