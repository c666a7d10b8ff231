package com.emcit.api.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Vault reveal challenge.
 *
 * ttl: lifetime of an issued challenge token. Zero disables expiry.
 */
@ConfigurationProperties(prefix = "emcit.captcha")
public record CaptchaProperties(@DefaultValue("5m") Duration ttl) {}
