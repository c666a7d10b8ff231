package com.emcit.application.vault;

import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.challenge.ChallengeTokenService;
import com.emcit.application.guard.AccessGate;
import com.emcit.application.ports.CryptoPort;
import com.emcit.application.ports.LicenseRepository;
import com.emcit.domain.access.Actor;
import com.emcit.domain.access.UnauthorizedException;
import com.emcit.domain.crypto.DecryptionException;
import com.emcit.domain.vault.CaptchaFailedException;
import com.emcit.domain.vault.LicenseFields;
import com.emcit.domain.vault.LicenseRecord;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.domain.vault.RevealedSecrets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Software-license vault.
 *
 * Product keys and login passwords are encrypted before they reach the repository and are only
 * decrypted by {@link #reveal}. Reveal fails closed: the role check and the challenge both run
 * before any stored token is opened.
 */
public final class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);

    private final LicenseRepository licenses;
    private final CryptoPort crypto;
    private final ChallengeTokenService challenges;
    private final AuditRecorder audit;
    private final Clock clock;

    public CredentialVault(LicenseRepository licenses, CryptoPort crypto, ChallengeTokenService challenges,
                           AuditRecorder audit, Clock clock) {
        this.licenses = Objects.requireNonNull(licenses, "licenses");
        this.crypto = Objects.requireNonNull(crypto, "crypto");
        this.challenges = Objects.requireNonNull(challenges, "challenges");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LicenseRecord create(Actor actor, LicenseFields fields, String productKey, String loginPassword,
                                String origin) {
        AccessGate.require(actor, AccessGate.ADMINS);
        Objects.requireNonNull(fields, "fields");
        if (productKey == null || productKey.isBlank()) {
            throw new IllegalArgumentException("productKey is required");
        }

        String passwordToken = (loginPassword == null || loginPassword.isBlank())
                ? null
                : crypto.encryptToPayload(loginPassword);

        LicenseRecord saved = licenses.save(new LicenseRecord(
                UUID.randomUUID(),
                fields,
                crypto.encryptToPayload(productKey),
                passwordToken,
                actor.userId(),
                clock.instant()
        ));
        audit.record(actor, AuditActions.LICENSE_CREATE, AuditActions.target("license", saved.id()), origin);
        return saved;
    }

    public List<LicenseRecord> list(Actor actor) {
        AccessGate.require(actor, AccessGate.ADMINS);
        return licenses.findAll();
    }

    /**
     * Licenses whose renewal date falls within the next {@code days} days (today included).
     */
    public List<LicenseRecord> expiringWithin(Actor actor, int days) {
        AccessGate.require(actor, AccessGate.ADMINS);
        LocalDate today = LocalDate.now(clock);
        return licenses.findRenewingBetween(today, today.plusDays(Math.max(0, days)));
    }

    /**
     * @throws UnauthorizedException   if the actor is absent or not an admin
     * @throws CaptchaFailedException  if the challenge does not verify
     * @throws RecordNotFoundException if no license has this id
     * @throws DecryptionException     if a stored token is corrupt
     */
    public RevealedSecrets reveal(UUID recordId, String claimedAnswer, String challengeToken, Actor actor,
                                  String origin) {
        String target = AuditActions.target("license", recordId);

        if (!AccessGate.authorize(actor, AccessGate.ADMINS)) {
            audit.record(actor, AuditActions.LICENSE_REVEAL_DENIED, target, origin);
            throw new UnauthorizedException();
        }

        if (!challenges.verify(claimedAnswer, challengeToken)) {
            audit.record(actor, AuditActions.LICENSE_REVEAL_DENIED, target, origin);
            throw new CaptchaFailedException();
        }

        LicenseRecord record = recordId == null ? null : licenses.findById(recordId).orElse(null);
        if (record == null) {
            audit.record(actor, AuditActions.LICENSE_REVEAL_DENIED, target, origin);
            throw new RecordNotFoundException(target);
        }

        RevealedSecrets secrets;
        try {
            String productKey = crypto.decryptPayload(record.productKeyToken());
            String password = record.hasLoginPassword()
                    ? crypto.decryptPayload(record.loginPasswordToken())
                    : RevealedSecrets.NO_PASSWORD;
            secrets = new RevealedSecrets(productKey, password);
        } catch (DecryptionException e) {
            log.error("Stored secret for {} could not be decrypted (corrupt data or rotated key)", target);
            audit.record(actor, AuditActions.LICENSE_REVEAL_DENIED, target, origin);
            throw e;
        }

        audit.record(actor, AuditActions.LICENSE_REVEAL, target, origin);
        return secrets;
    }
}
