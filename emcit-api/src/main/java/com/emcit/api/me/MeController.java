package com.emcit.api.me;

import com.emcit.api.admin.AdminAssetController.AssetRow;
import com.emcit.api.security.SecurityActor;
import com.emcit.application.guard.AccessGate;
import com.emcit.domain.access.Actor;
import com.emcit.infrastructure.asset.AssetRepository;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class MeController {

  private final AssetRepository assets;

  public MeController(AssetRepository assets) {
    this.assets = assets;
  }

  @GetMapping("/api/v1/me")
  public Map<String, Object> me(@AuthenticationPrincipal Jwt jwt) {
    return Map.of(
        "userId", jwt.getSubject(),
        "email", jwt.getClaimAsString("email"),
        "role", jwt.getClaimAsString("role")
    );
  }

  /** Assets currently assigned to the caller. */
  @GetMapping("/api/v1/assets/mine")
  public List<AssetRow> myAssets() {
    Actor actor = AccessGate.require(SecurityActor.current(), AccessGate.ANY_ROLE);
    return assets.findByAssignedToOrderByAssetIdAsc(actor.userId()).stream()
        .map(AssetRow::of)
        .toList();
  }
}
