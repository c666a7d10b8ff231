package com.emcit.api.wiring;

import com.emcit.api.config.CaptchaProperties;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.challenge.ChallengeTokenService;
import com.emcit.application.ports.AuditLogPort;
import com.emcit.application.ports.ChallengeImagePort;
import com.emcit.application.ports.CryptoPort;
import com.emcit.application.ports.LicenseRepository;
import com.emcit.application.vault.CredentialVault;
import com.emcit.infrastructure.captcha.ArithmeticCaptchaRenderer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class EmcitWiringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChallengeImagePort challengeImagePort() {
        return new ArithmeticCaptchaRenderer();
    }

    @Bean
    public ChallengeTokenService challengeTokenService(
            CryptoPort crypto,
            ChallengeImagePort images,
            Clock clock,
            CaptchaProperties captcha
    ) {
        return new ChallengeTokenService(crypto, images, new SecureRandom(), clock, captcha.ttl());
    }

    /**
     * Audit boundary. Best-effort: append failures are logged, never propagated.
     */
    @Bean
    public AuditRecorder auditRecorder(AuditLogPort auditLog, Clock clock) {
        return new AuditRecorder(auditLog, clock, RequestContext::requestId);
    }

    @Bean
    public CredentialVault credentialVault(
            LicenseRepository licenses,
            CryptoPort crypto,
            ChallengeTokenService challenges,
            AuditRecorder audit,
            Clock clock
    ) {
        return new CredentialVault(licenses, crypto, challenges, audit, clock);
    }
}
