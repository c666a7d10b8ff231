package com.emcit.infrastructure.department;

import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "departments", uniqueConstraints = @UniqueConstraint(name = "uk_departments_name", columnNames = "name"))
public class DepartmentEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @OneToMany(mappedBy = "department", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("name ASC")
  private List<SubDepartmentEntity> subDepartments = new ArrayList<>();

  protected DepartmentEntity() {}

  public DepartmentEntity(UUID id, String name) {
    this.id = id;
    this.name = name;
  }

  public UUID getId() { return id; }
  public String getName() { return name; }
  public List<SubDepartmentEntity> getSubDepartments() { return subDepartments; }

  public SubDepartmentEntity addSubDepartment(String subName) {
    SubDepartmentEntity sub = new SubDepartmentEntity(UUID.randomUUID(), subName, this);
    subDepartments.add(sub);
    return sub;
  }
}
