package com.emcit.api.wiring;

import com.emcit.application.ports.CryptoPort;
import com.emcit.domain.crypto.EncryptionConfigException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class CryptoConfigTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(CryptoConfig.class);

  @Test
  void missingKeyAbortsStartup() {
    runner.run(ctx -> {
      assertThat(ctx).hasFailed();
      assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(EncryptionConfigException.class);
    });
  }

  @Test
  void shortKeyAbortsStartup() {
    runner.withPropertyValues("emcit.crypto.encryption-key=c2hvcnQta2V5")
        .run(ctx -> assertThat(ctx.getStartupFailure()).hasRootCauseInstanceOf(EncryptionConfigException.class));
  }

  @Test
  void validKeyProvidesCipher() {
    runner.withPropertyValues("emcit.crypto.encryption-key=MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=")
        .run(ctx -> {
          assertThat(ctx).hasNotFailed().hasSingleBean(CryptoPort.class);
          CryptoPort crypto = ctx.getBean(CryptoPort.class);
          assertThat(crypto.decryptPayload(crypto.encryptToPayload("ok"))).isEqualTo("ok");
        });
  }
}
