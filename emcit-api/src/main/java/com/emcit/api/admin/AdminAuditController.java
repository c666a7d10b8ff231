package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.application.audit.AuditRecorder;
import com.emcit.domain.audit.AuditEntry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class AdminAuditController {

  private final AuditRecorder audit;

  public AdminAuditController(AuditRecorder audit) {
    this.audit = audit;
  }

  @GetMapping("/api/v1/admin/audit")
  public List<AuditEntry> recent(@RequestParam(defaultValue = "50") int limit) {
    return audit.recent(SecurityActor.current(), limit);
  }
}
