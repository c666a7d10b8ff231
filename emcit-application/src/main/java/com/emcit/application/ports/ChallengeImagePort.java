package com.emcit.application.ports;

public interface ChallengeImagePort {

    /**
     * Renders the challenge prompt (digits, '+', '=', '?' and spaces) as a PNG image.
     */
    byte[] renderPng(String prompt);
}
