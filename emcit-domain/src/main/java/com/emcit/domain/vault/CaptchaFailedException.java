package com.emcit.domain.vault;

import com.emcit.domain.DomainException;

/**
 * Challenge answer did not verify. Wrong answers and unreadable tokens both end up here.
 */
public final class CaptchaFailedException extends DomainException {

    public CaptchaFailedException() {
        super("Incorrect Captcha! Access Denied.");
    }
}
