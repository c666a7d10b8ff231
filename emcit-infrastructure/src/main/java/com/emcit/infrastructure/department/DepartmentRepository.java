package com.emcit.infrastructure.department;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DepartmentRepository extends JpaRepository<DepartmentEntity, UUID> {

  boolean existsByNameIgnoreCase(String name);

  @EntityGraph(attributePaths = "subDepartments")
  List<DepartmentEntity> findAllByOrderByNameAsc();
}
