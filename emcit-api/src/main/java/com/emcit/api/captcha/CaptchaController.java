package com.emcit.api.captcha;

import com.emcit.application.challenge.ChallengeTokenService;
import com.emcit.domain.challenge.IssuedChallenge;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues the challenge shown before a vault reveal.
 * The image is the body; the encrypted answer token travels in {@value #HDR_CAPTCHA_TOKEN}.
 */
@RestController
public class CaptchaController {

  public static final String HDR_CAPTCHA_TOKEN = "X-Captcha-Token";

  private final ChallengeTokenService challenges;

  public CaptchaController(ChallengeTokenService challenges) {
    this.challenges = challenges;
  }

  @GetMapping(value = "/api/captcha", produces = MediaType.IMAGE_PNG_VALUE)
  public ResponseEntity<byte[]> captcha() {
    IssuedChallenge issued = challenges.issue();
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .cacheControl(CacheControl.noStore())
        .header(HDR_CAPTCHA_TOKEN, issued.token())
        .header("Access-Control-Expose-Headers", HDR_CAPTCHA_TOKEN)
        .body(issued.image());
  }
}
