package com.emcit.application.challenge;

import com.emcit.application.ports.ChallengeImagePort;
import com.emcit.application.ports.CryptoPort;
import com.emcit.domain.challenge.Challenge;
import com.emcit.domain.challenge.IssuedChallenge;
import com.emcit.domain.crypto.DecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Stateless arithmetic challenge.
 *
 * The expected answer travels to the caller inside an encrypted token and must come back
 * unchanged; no server-side session is kept, so any instance holding the key can verify.
 *
 * Token payload (before encryption):
 * - {@code <answer>|<expiresAtEpochSecond>} when a TTL is configured
 * - {@code <answer>} when the TTL is zero or negative
 */
public final class ChallengeTokenService {

    private static final Logger log = LoggerFactory.getLogger(ChallengeTokenService.class);

    static final int LEFT_MIN = 10;
    static final int LEFT_MAX = 99;
    static final int RIGHT_MIN = 1;
    static final int RIGHT_MAX = 9;

    private static final char EXPIRY_SEPARATOR = '|';

    private final CryptoPort crypto;
    private final ChallengeImagePort images;
    private final RandomGenerator random;
    private final Clock clock;
    private final Duration ttl;

    public ChallengeTokenService(CryptoPort crypto, ChallengeImagePort images, RandomGenerator random,
                                 Clock clock, Duration ttl) {
        this.crypto = Objects.requireNonNull(crypto, "crypto");
        this.images = Objects.requireNonNull(images, "images");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = ttl == null ? Duration.ZERO : ttl;
    }

    public IssuedChallenge issue() {
        Challenge challenge = new Challenge(
                random.nextInt(LEFT_MIN, LEFT_MAX + 1),
                random.nextInt(RIGHT_MIN, RIGHT_MAX + 1)
        );
        byte[] png = images.renderPng(challenge.prompt());
        String token = crypto.encryptToPayload(payloadFor(challenge.answer()));
        return new IssuedChallenge(png, token);
    }

    /**
     * Compares the claimed answer, stripped of surrounding Unicode whitespace, with the answer sealed in the token, as strings.
     * An unreadable, foreign or expired token is a failed verification, never an error.
     */
    public boolean verify(String claimedAnswer, String token) {
        if (claimedAnswer == null || token == null || token.isBlank()) return false;

        String payload;
        try {
            payload = crypto.decryptPayload(token.trim());
        } catch (DecryptionException e) {
            log.debug("Challenge token rejected: {}", e.getMessage());
            return false;
        }

        String expected = payload;
        int sep = payload.lastIndexOf(EXPIRY_SEPARATOR);
        if (sep >= 0) {
            expected = payload.substring(0, sep);
            long expiresAt;
            try {
                expiresAt = Long.parseLong(payload.substring(sep + 1));
            } catch (NumberFormatException e) {
                return false;
            }
            if (clock.instant().getEpochSecond() > expiresAt) {
                log.debug("Challenge token expired");
                return false;
            }
        } else if (expiryEnabled()) {
            // tokens without expiry are only honoured when expiry is switched off
            return false;
        }

        return MessageDigest.isEqual(
                stripAnswer(claimedAnswer).getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8)
        );
    }

    // Character.isWhitespace skips no-break spaces; isSpaceChar covers them.
    static String stripAnswer(String s) {
        int begin = 0;
        int end = s.length();
        while (begin < end && isBlankChar(s.charAt(begin))) begin++;
        while (end > begin && isBlankChar(s.charAt(end - 1))) end--;
        return s.substring(begin, end);
    }

    private static boolean isBlankChar(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private String payloadFor(String answer) {
        if (!expiryEnabled()) return answer;
        long expiresAt = clock.instant().plus(ttl).getEpochSecond();
        return answer + EXPIRY_SEPARATOR + expiresAt;
    }

    private boolean expiryEnabled() {
        return !ttl.isZero() && !ttl.isNegative();
    }
}
