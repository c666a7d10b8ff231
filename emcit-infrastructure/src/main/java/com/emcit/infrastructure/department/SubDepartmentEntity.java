package com.emcit.infrastructure.department;

import jakarta.persistence.*;

import java.util.UUID;

@Entity
@Table(name = "sub_departments")
public class SubDepartmentEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "department_id", nullable = false)
  private DepartmentEntity department;

  protected SubDepartmentEntity() {}

  SubDepartmentEntity(UUID id, String name, DepartmentEntity department) {
    this.id = id;
    this.name = name;
    this.department = department;
  }

  public UUID getId() { return id; }
  public String getName() { return name; }
  public DepartmentEntity getDepartment() { return department; }
}
