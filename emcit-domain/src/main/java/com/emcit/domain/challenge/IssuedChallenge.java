package com.emcit.domain.challenge;

/**
 * Rendered challenge image (PNG) and the encrypted answer token the caller must echo back.
 */
public record IssuedChallenge(byte[] image, String token) {
}
