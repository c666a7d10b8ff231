package com.emcit.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Initial super admin, created at startup when both email and password are set
 * and no user with that email exists yet.
 */
@ConfigurationProperties(prefix = "emcit.bootstrap")
public record BootstrapProperties(
    String adminEmail,
    String adminPassword,
    @DefaultValue("IT Super Admin") String adminName
) {

  public boolean enabled() {
    return adminEmail != null && !adminEmail.isBlank()
        && adminPassword != null && !adminPassword.isBlank();
  }

  @Override
  public String toString() {
    return "BootstrapProperties[adminEmail=" + adminEmail + ", adminPassword=****]";
  }
}
