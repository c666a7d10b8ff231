package com.emcit.api.auth;

import com.emcit.domain.access.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

  private final AuthService auth;

  public AuthController(AuthService auth) {
    this.auth = auth;
  }

  public record LoginRequest(
      @Email @NotBlank String email,
      @NotBlank String password
  ) {}

  /** {@code landing} tells the client which console to open: admins get the dashboard, staff the portal. */
  public record AuthResponse(
      String accessToken,
      String tokenType,
      long expiresInSeconds,
      String role,
      String landing
  ) {}

  @PostMapping(value = "/login", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
    var t = auth.login(req.email(), req.password());
    String landing = t.role() == Role.USER ? "portal" : "admin-dashboard";
    return ResponseEntity.ok(new AuthResponse(t.value(), "Bearer", t.expiresInSeconds(), t.role().claim(), landing));
  }
}
