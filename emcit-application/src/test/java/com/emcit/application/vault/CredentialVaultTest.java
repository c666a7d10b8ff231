package com.emcit.application.vault;

import com.emcit.application.SealingCrypto;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.challenge.ChallengeTokenService;
import com.emcit.application.ports.AuditLogPort;
import com.emcit.application.ports.LicenseRepository;
import com.emcit.domain.access.Actor;
import com.emcit.domain.access.Role;
import com.emcit.domain.access.UnauthorizedException;
import com.emcit.domain.audit.AuditEntry;
import com.emcit.domain.challenge.IssuedChallenge;
import com.emcit.domain.crypto.DecryptionException;
import com.emcit.domain.vault.CaptchaFailedException;
import com.emcit.domain.vault.LicenseFields;
import com.emcit.domain.vault.LicenseRecord;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.domain.vault.RevealedSecrets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CredentialVault")
class CredentialVaultTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ORIGIN = "10.0.0.7";

    @Mock
    private AuditLogPort auditLog;

    @Mock
    private RandomGenerator random;

    private final Actor admin = new Actor(UUID.randomUUID(), Role.ADMIN);
    private final Actor superAdmin = new Actor(UUID.randomUUID(), Role.SUPER_ADMIN);
    private final Actor user = new Actor(UUID.randomUUID(), Role.USER);

    private SealingCrypto crypto;
    private InMemoryLicenses licenses;
    private ChallengeTokenService challenges;
    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        crypto = new SealingCrypto("vault");
        licenses = new InMemoryLicenses();
        challenges = new ChallengeTokenService(crypto, prompt -> new byte[0], random, clock, Duration.ofMinutes(5));
        vault = new CredentialVault(licenses, crypto, challenges, new AuditRecorder(auditLog, clock, () -> "req-1"), clock);
    }

    private static LicenseFields fields(String name, LocalDate renewal) {
        return new LicenseFields(name, "Subscription", "Acme", null, null, renewal, "svc-account", "1200", 25);
    }

    private IssuedChallenge challenge(int left, int right) {
        when(random.nextInt(anyInt(), anyInt())).thenReturn(left, right);
        return challenges.issue();
    }

    private List<String> auditedActions() {
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLog, atLeastOnce()).append(captor.capture());
        return captor.getAllValues().stream().map(AuditEntry::action).toList();
    }

    @Test
    void createStoresOnlyEncryptedSecrets() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", "s3cret", ORIGIN);

        LicenseRecord stored = licenses.findById(saved.id()).orElseThrow();
        assertThat(stored.productKeyToken()).isNotEqualTo("ABC-123-XYZ").startsWith("sealed[vault]:");
        assertThat(stored.loginPasswordToken()).isNotEqualTo("s3cret");
        assertThat(stored.createdBy()).isEqualTo(admin.userId());
        assertThat(stored.createdAt()).isEqualTo(NOW);
        assertThat(auditedActions()).containsExactly(AuditActions.LICENSE_CREATE);
    }

    @Test
    void createTreatsEmptyOrBlankPasswordAsAbsent() {
        LicenseRecord empty = vault.create(admin, fields("Office", null), "ABC-123-XYZ", "", ORIGIN);
        LicenseRecord blank = vault.create(admin, fields("Visio", null), "DEF-456", "   ", ORIGIN);

        assertThat(empty.hasLoginPassword()).isFalse();
        assertThat(blank.hasLoginPassword()).isFalse();
        assertThat(blank.loginPasswordToken()).isNull();
    }

    @Test
    void createRequiresAdminAndProductKey() {
        assertThatThrownBy(() -> vault.create(user, fields("Office", null), "K", null, ORIGIN))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> vault.create(null, fields("Office", null), "K", null, ORIGIN))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> vault.create(admin, fields("Office", null), " ", null, ORIGIN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("productKey is required");
        assertThat(licenses.findAll()).isEmpty();
    }

    @Test
    void revealWithCorrectAnswerReturnsPlaintextAndNaPassword() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);
        IssuedChallenge issued = challenge(47, 3);

        RevealedSecrets secrets = vault.reveal(saved.id(), "50", issued.token(), admin, ORIGIN);

        assertThat(secrets.productKey()).isEqualTo("ABC-123-XYZ");
        assertThat(secrets.password()).isEqualTo(RevealedSecrets.NO_PASSWORD);
        assertThat(auditedActions()).containsExactly(AuditActions.LICENSE_CREATE, AuditActions.LICENSE_REVEAL);
    }

    @Test
    void superAdminMayRevealStoredPassword() {
        LicenseRecord saved = vault.create(admin, fields("VPN", null), "KEY-1", "hunter22", ORIGIN);
        IssuedChallenge issued = challenge(10, 9);

        RevealedSecrets secrets = vault.reveal(saved.id(), " 19 ", issued.token(), superAdmin, ORIGIN);

        assertThat(secrets.password()).isEqualTo("hunter22");
    }

    @Test
    void userRoleIsRefusedBeforeChallengeOrDecryption() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);
        IssuedChallenge issued = challenge(47, 3);
        int decryptsBefore = crypto.decryptCalls.get();

        assertThatThrownBy(() -> vault.reveal(saved.id(), "50", issued.token(), user, ORIGIN))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Unauthorized");

        assertThat(crypto.decryptCalls.get()).isEqualTo(decryptsBefore);
        assertThat(auditedActions()).endsWith(AuditActions.LICENSE_REVEAL_DENIED);
    }

    @Test
    void anonymousCallerIsRefused() {
        assertThatThrownBy(() -> vault.reveal(UUID.randomUUID(), "50", "t", null, ORIGIN))
                .isInstanceOf(UnauthorizedException.class);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLog).append(captor.capture());
        assertThat(captor.getValue().actorId()).isNull();
        assertThat(captor.getValue().action()).isEqualTo(AuditActions.LICENSE_REVEAL_DENIED);
    }

    @Test
    void wrongAnswerIsCaptchaFailure() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);
        IssuedChallenge issued = challenge(47, 3);

        assertThatThrownBy(() -> vault.reveal(saved.id(), "49", issued.token(), admin, ORIGIN))
                .isInstanceOf(CaptchaFailedException.class)
                .hasMessage("Incorrect Captcha! Access Denied.");
    }

    @Test
    void answerToAnotherChallengeFails() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);
        when(random.nextInt(anyInt(), anyInt())).thenReturn(47, 3, 20, 5);
        challenges.issue();
        IssuedChallenge second = challenges.issue();

        assertThatThrownBy(() -> vault.reveal(saved.id(), "50", second.token(), admin, ORIGIN))
                .isInstanceOf(CaptchaFailedException.class);
        assertThat(vault.reveal(saved.id(), "25", second.token(), admin, ORIGIN).productKey()).isEqualTo("ABC-123-XYZ");
    }

    @Test
    void malformedTokenIsCaptchaFailure() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);

        assertThatThrownBy(() -> vault.reveal(saved.id(), "50", "garbage", admin, ORIGIN))
                .isInstanceOf(CaptchaFailedException.class);
    }

    @Test
    void unknownRecordIsNotFoundAfterChallenge() {
        IssuedChallenge issued = challenge(47, 3);
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> vault.reveal(missing, "50", issued.token(), admin, ORIGIN))
                .isInstanceOf(RecordNotFoundException.class)
                .hasMessage("Not Found")
                .extracting(e -> ((RecordNotFoundException) e).target())
                .isEqualTo("license:" + missing);
        assertThat(auditedActions()).containsExactly(AuditActions.LICENSE_REVEAL_DENIED);
    }

    @Test
    void nullRecordIdIsNotFound() {
        IssuedChallenge issued = challenge(47, 3);

        assertThatThrownBy(() -> vault.reveal(null, "50", issued.token(), admin, ORIGIN))
                .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void corruptStoredTokenSurfacesDecryptionFailure() {
        LicenseRecord corrupt = licenses.save(new LicenseRecord(
                UUID.randomUUID(), fields("Broken", null), "sealed[other]:xyz", null, admin.userId(), NOW));
        IssuedChallenge issued = challenge(47, 3);

        assertThatThrownBy(() -> vault.reveal(corrupt.id(), "50", issued.token(), admin, ORIGIN))
                .isInstanceOf(DecryptionException.class);
        assertThat(auditedActions()).containsExactly(AuditActions.LICENSE_REVEAL_DENIED);
    }

    @Test
    void auditEntriesCarryOriginAndRequestId() {
        vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLog).append(captor.capture());
        AuditEntry entry = captor.getValue();
        assertThat(entry.originAddress()).isEqualTo(ORIGIN);
        assertThat(entry.requestId()).isEqualTo("req-1");
        assertThat(entry.target()).startsWith("license:");
        assertThat(entry.timestamp()).isEqualTo(NOW);
    }

    @Test
    void auditFailureDoesNotBlockReveal() {
        LicenseRecord saved = vault.create(admin, fields("Office", null), "ABC-123-XYZ", null, ORIGIN);
        IssuedChallenge issued = challenge(47, 3);
        doThrow(new IllegalStateException("db down")).when(auditLog).append(any());

        assertThat(vault.reveal(saved.id(), "50", issued.token(), admin, ORIGIN).productKey()).isEqualTo("ABC-123-XYZ");
    }

    @Test
    void expiringWithinUsesTodayInclusiveWindow() {
        vault.create(admin, fields("Soon", LocalDate.of(2026, 3, 20)), "K1", null, ORIGIN);
        vault.create(admin, fields("Today", LocalDate.of(2026, 3, 1)), "K2", null, ORIGIN);
        vault.create(admin, fields("Later", LocalDate.of(2026, 5, 1)), "K3", null, ORIGIN);
        vault.create(admin, fields("Lapsed", LocalDate.of(2026, 2, 1)), "K4", null, ORIGIN);
        vault.create(admin, fields("Perpetual", null), "K5", null, ORIGIN);

        List<String> names = vault.expiringWithin(admin, 30).stream().map(r -> r.fields().softwareName()).toList();

        assertThat(names).containsExactly("Today", "Soon");
        assertThatThrownBy(() -> vault.expiringWithin(user, 30)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void listIsAdminOnly() {
        vault.create(admin, fields("Office", null), "K", null, ORIGIN);

        assertThat(vault.list(superAdmin)).hasSize(1);
        assertThatThrownBy(() -> vault.list(user)).isInstanceOf(UnauthorizedException.class);
    }

    private static final class InMemoryLicenses implements LicenseRepository {
        private final Map<UUID, LicenseRecord> rows = new LinkedHashMap<>();

        @Override
        public LicenseRecord save(LicenseRecord record) {
            rows.put(record.id(), record);
            return record;
        }

        @Override
        public Optional<LicenseRecord> findById(UUID id) {
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public List<LicenseRecord> findAll() {
            return new ArrayList<>(rows.values());
        }

        @Override
        public List<LicenseRecord> findRenewingBetween(LocalDate from, LocalDate to) {
            return rows.values().stream()
                    .filter(r -> r.fields().renewalDate() != null)
                    .filter(r -> !r.fields().renewalDate().isBefore(from) && !r.fields().renewalDate().isAfter(to))
                    .sorted(Comparator.comparing(r -> r.fields().renewalDate()))
                    .toList();
        }
    }
}
