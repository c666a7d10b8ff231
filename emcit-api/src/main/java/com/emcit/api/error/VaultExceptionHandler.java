package com.emcit.api.error;

import com.emcit.domain.access.UnauthorizedException;
import com.emcit.domain.crypto.DecryptionException;
import com.emcit.domain.vault.CaptchaFailedException;
import com.emcit.domain.vault.RecordNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Refusals from the access gate and the vault. The body is always exactly {"error": message},
 * so a failed reveal never carries partial secret fields.
 */
@RestControllerAdvice
public class VaultExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(VaultExceptionHandler.class);

  static final String NOT_FOUND = "Not Found";

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<Map<String, String>> unauthorized(UnauthorizedException ex) {
    return error(HttpStatus.FORBIDDEN, ex.getMessage());
  }

  @ExceptionHandler(CaptchaFailedException.class)
  public ResponseEntity<Map<String, String>> captchaFailed(CaptchaFailedException ex) {
    return error(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(RecordNotFoundException.class)
  public ResponseEntity<Map<String, String>> notFound(RecordNotFoundException ex) {
    log.debug("No record for {}", ex.target());
    return error(HttpStatus.NOT_FOUND, NOT_FOUND);
  }

  // Corrupt stored token: details were logged by the vault, the caller only sees "Not Found".
  @ExceptionHandler(DecryptionException.class)
  public ResponseEntity<Map<String, String>> undecryptable(DecryptionException ex) {
    return error(HttpStatus.NOT_FOUND, NOT_FOUND);
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(Map.of("error", message));
  }
}
