package com.emcit.infrastructure.asset;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AssetRepository extends JpaRepository<AssetEntity, UUID> {

  List<AssetEntity> findAllByOrderByCreatedAtDesc();

  List<AssetEntity> findByAssignedToOrderByAssetIdAsc(UUID userId);
}
