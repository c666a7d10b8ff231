package com.emcit.api.health;

import com.emcit.api.config.CaptchaProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/** Liveness for load balancers; the context only starts with a valid encryption key. */
@RestController
public class HealthController {

  private final Clock clock;
  private final CaptchaProperties captcha;

  public HealthController(Clock clock, CaptchaProperties captcha) {
    this.clock = clock;
    this.captcha = captcha;
  }

  @GetMapping("/api/v1/health")
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "emcit-api",
        "vault", "ready",
        "captchaTtlSeconds", captcha.ttl().getSeconds(),
        "ts", clock.instant().toString()
    );
  }
}
