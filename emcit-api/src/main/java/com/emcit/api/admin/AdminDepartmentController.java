package com.emcit.api.admin;

import com.emcit.api.security.SecurityActor;
import com.emcit.application.audit.AuditActions;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.vault.RecordNotFoundException;
import com.emcit.infrastructure.department.DepartmentEntity;
import com.emcit.infrastructure.department.DepartmentRepository;
import com.emcit.infrastructure.department.SubDepartmentEntity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/departments")
public class AdminDepartmentController {

  private final DepartmentRepository departments;

  public AdminDepartmentController(DepartmentRepository departments) {
    this.departments = departments;
  }

  public record NameRequest(@NotBlank String name) {}

  public record SubDepartmentRow(UUID id, String name) {}

  public record DepartmentRow(UUID id, String name, List<SubDepartmentRow> subDepartments) {
    static DepartmentRow of(DepartmentEntity d) {
      return new DepartmentRow(
          d.getId(),
          d.getName(),
          d.getSubDepartments().stream().map(s -> new SubDepartmentRow(s.getId(), s.getName())).toList()
      );
    }
  }

  @GetMapping
  @Transactional(readOnly = true)
  public List<DepartmentRow> list() {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    return departments.findAllByOrderByNameAsc().stream().map(DepartmentRow::of).toList();
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @Transactional
  public DepartmentRow create(@Valid @RequestBody NameRequest req) {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    String name = req.name().trim();
    if (departments.existsByNameIgnoreCase(name)) {
      throw new IllegalArgumentException("department already exists");
    }
    DepartmentEntity saved = departments.save(new DepartmentEntity(UUID.randomUUID(), name));
    return DepartmentRow.of(saved);
  }

  @PostMapping("/{id}/sub-departments")
  @ResponseStatus(HttpStatus.CREATED)
  @Transactional
  public DepartmentRow addSubDepartment(@PathVariable UUID id, @Valid @RequestBody NameRequest req) {
    AccessGate.require(SecurityActor.current(), AccessGate.ADMINS);
    DepartmentEntity d = departments.findById(id)
        .orElseThrow(() -> new RecordNotFoundException(AuditActions.target("department", id)));
    String name = req.name().trim();
    for (SubDepartmentEntity s : d.getSubDepartments()) {
      if (s.getName().equalsIgnoreCase(name)) {
        throw new IllegalArgumentException("sub-department already exists");
      }
    }
    d.addSubDepartment(name);
    return DepartmentRow.of(departments.save(d));
  }
}
