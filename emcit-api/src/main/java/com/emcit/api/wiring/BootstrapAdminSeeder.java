package com.emcit.api.wiring;

import com.emcit.api.config.BootstrapProperties;
import com.emcit.domain.access.Role;
import com.emcit.infrastructure.user.UserEntity;
import com.emcit.infrastructure.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Creates the first super admin so a fresh database can be logged into.
 * Does nothing when the account already exists or bootstrap is not configured.
 */
@Component
public class BootstrapAdminSeeder implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(BootstrapAdminSeeder.class);

  private final BootstrapProperties props;
  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final Clock clock;

  public BootstrapAdminSeeder(BootstrapProperties props, UserRepository users, PasswordEncoder passwordEncoder,
                              Clock clock) {
    this.props = props;
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.clock = clock;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!props.enabled()) {
      log.debug("Bootstrap admin not configured; skipping");
      return;
    }
    String email = props.adminEmail().trim().toLowerCase(Locale.ROOT);
    if (users.existsByEmailIgnoreCase(email)) {
      return;
    }
    var admin = new UserEntity(
        UUID.randomUUID(),
        props.adminName(),
        email,
        passwordEncoder.encode(props.adminPassword()),
        Role.SUPER_ADMIN.claim(),
        clock.instant()
    );
    admin.setDesignation("Head of IT");
    users.save(admin);
    log.info("Bootstrap super admin created: {}", email);
  }
}
