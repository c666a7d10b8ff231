package com.emcit.infrastructure.user;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users", uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
public class UserEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "full_name", nullable = false, length = 200)
  private String fullName;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  @Column(name = "password_hash", nullable = false, length = 100)
  private String passwordHash;

  // user | admin | super_admin
  @Column(name = "role", nullable = false, length = 20)
  private String role;

  @Column(name = "employee_id", length = 64)
  private String employeeId;

  @Column(name = "designation", length = 120)
  private String designation;

  @Column(name = "department", length = 120)
  private String department;

  @Column(name = "sub_department", length = 120)
  private String subDepartment;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(UUID id, String fullName, String email, String passwordHash, String role, Instant createdAt) {
    this.id = id;
    this.fullName = fullName;
    this.email = email;
    this.passwordHash = passwordHash;
    this.role = role;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getFullName() { return fullName; }
  public String getEmail() { return email; }
  public String getPasswordHash() { return passwordHash; }
  public String getRole() { return role; }
  public String getEmployeeId() { return employeeId; }
  public String getDesignation() { return designation; }
  public String getDepartment() { return department; }
  public String getSubDepartment() { return subDepartment; }
  public Instant getCreatedAt() { return createdAt; }

  public void setFullName(String fullName) { this.fullName = fullName; }
  public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }
  public void setRole(String role) { this.role = role; }
  public void setEmployeeId(String employeeId) { this.employeeId = employeeId; }
  public void setDesignation(String designation) { this.designation = designation; }
  public void setDepartment(String department) { this.department = department; }
  public void setSubDepartment(String subDepartment) { this.subDepartment = subDepartment; }
}
