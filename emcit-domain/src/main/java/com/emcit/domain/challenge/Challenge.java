package com.emcit.domain.challenge;

/**
 * Arithmetic challenge: "{@code left} + {@code right} = ?".
 */
public record Challenge(int left, int right) {

    public String prompt() {
        return left + " + " + right + " = ?";
    }

    public String answer() {
        return String.valueOf(left + right);
    }
}
