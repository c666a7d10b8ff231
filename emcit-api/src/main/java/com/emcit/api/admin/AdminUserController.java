package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.api.tracing.RequestContext;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.access.Actor;
import com.emcit.domain.access.Role;
import com.emcit.domain.access.UnauthorizedException;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.infrastructure.user.UserEntity;
import com.emcit.infrastructure.user.UserRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * User administration.
 *
 * Only a SUPER_ADMIN may create, promote to, or delete accounts at the SUPER_ADMIN level,
 * and only a SUPER_ADMIN may delete users at all.
 */
@RestController
@RequestMapping("/api/v1/admin/users")
public class AdminUserController {

  private final UserRepository users;
  private final PasswordEncoder passwordEncoder;
  private final AuditRecorder audit;
  private final Clock clock;

  public AdminUserController(UserRepository users, PasswordEncoder passwordEncoder, AuditRecorder audit, Clock clock) {
    this.users = users;
    this.passwordEncoder = passwordEncoder;
    this.audit = audit;
    this.clock = clock;
  }

  public record CreateUserRequest(
      @NotBlank String fullName,
      @NotBlank @Email String email,
      @NotBlank @Size(min = 8, max = 128) String password,
      @NotBlank String role,
      String employeeId,
      String designation,
      String department,
      String subDepartment
  ) {
    @Override
    public String toString() {
      return "CreateUserRequest[email=" + email + ", role=" + role + "]";
    }
  }

  public record UpdateUserRequest(
      String fullName,
      String role,
      @Size(min = 8, max = 128) String password,
      String employeeId,
      String designation,
      String department,
      String subDepartment
  ) {
    @Override
    public String toString() {
      return "UpdateUserRequest[role=" + role + "]";
    }
  }

  public record UserRow(
      UUID id,
      String fullName,
      String email,
      String role,
      String employeeId,
      String designation,
      String department,
      String subDepartment,
      String createdAt
  ) {
    static UserRow of(UserEntity u) {
      return new UserRow(
          u.getId(),
          u.getFullName(),
          u.getEmail(),
          u.getRole(),
          u.getEmployeeId(),
          u.getDesignation(),
          u.getDepartment(),
          u.getSubDepartment(),
          u.getCreatedAt() == null ? null : u.getCreatedAt().toString()
      );
    }
  }

  @GetMapping
  public List<UserRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return users.findAllByOrderByCreatedAtDesc().stream().map(UserRow::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @Transactional
  public UserRow create(@Valid @RequestBody CreateUserRequest req) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    Role role = parseRole(req.role());
    requireSuperAdminFor(actor, role);

    String email = req.email().trim().toLowerCase(Locale.ROOT);
    if (users.existsByEmailIgnoreCase(email)) {
      throw new IllegalArgumentException("email already registered");
    }

    UserEntity u = new UserEntity(
        UUID.randomUUID(),
        req.fullName().trim(),
        email,
        passwordEncoder.encode(req.password()),
        role.claim(),
        clock.instant()
    );
    u.setEmployeeId(req.employeeId());
    u.setDesignation(req.designation());
    u.setDepartment(req.department());
    u.setSubDepartment(req.subDepartment());
    users.save(u);

    audit.record(actor, AuditActions.USER_CREATE, AuditActions.target("user", u.getId()), RequestContext.originAddress());
    return UserRow.of(u);
  }

  @PutMapping("/{id}")
  @Transactional
  public UserRow update(@PathVariable UUID id, @Valid @RequestBody UpdateUserRequest req) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    UserEntity u = users.findById(id).orElseThrow(() -> new RecordNotFoundException(AuditActions.target("user", id)));

    // touching a super admin account is itself a super admin operation
    Role current = Role.parse(u.getRole()).orElse(Role.USER);
    requireSuperAdminFor(actor, current);

    if (req.role() != null && !req.role().isBlank()) {
      Role next = parseRole(req.role());
      requireSuperAdminFor(actor, next);
      u.setRole(next.claim());
    }
    if (req.fullName() != null && !req.fullName().isBlank()) u.setFullName(req.fullName().trim());
    if (req.password() != null && !req.password().isBlank()) u.setPasswordHash(passwordEncoder.encode(req.password()));
    if (req.employeeId() != null) u.setEmployeeId(req.employeeId());
    if (req.designation() != null) u.setDesignation(req.designation());
    if (req.department() != null) u.setDepartment(req.department());
    if (req.subDepartment() != null) u.setSubDepartment(req.subDepartment());
    users.save(u);

    audit.record(actor, AuditActions.USER_UPDATE, AuditActions.target("user", id), RequestContext.originAddress());
    return UserRow.of(u);
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  @Transactional
  public void delete(@PathVariable UUID id) {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.SUPER_ADMINS);
    if (actor.userId().equals(id)) {
      throw new IllegalArgumentException("cannot delete your own account");
    }
    UserEntity u = users.findById(id).orElseThrow(() -> new RecordNotFoundException(AuditActions.target("user", id)));
    users.delete(u);
    audit.record(actor, AuditActions.USER_DELETE, AuditActions.target("user", id), RequestContext.originAddress());
  }

  private static Role parseRole(String raw) {
    return Role.parse(raw).orElseThrow(() -> new IllegalArgumentException("role: unknown value"));
  }

  private static void requireSuperAdminFor(Actor actor, Role target) {
    if (target == Role.SUPER_ADMIN && !actor.hasRole(Role.SUPER_ADMIN)) {
      throw new UnauthorizedException();
    }
  }
}
