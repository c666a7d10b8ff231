package com.emcit.infrastructure.consumable;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ConsumableRepository extends JpaRepository<ConsumableEntity, UUID> {

  List<ConsumableEntity> findAllByOrderByItemNameAsc();
}
