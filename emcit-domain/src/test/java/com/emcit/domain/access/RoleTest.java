package com.emcit.domain.access;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleTest {

    @Test
    void parsesStoredAndClaimForms() {
        assertThat(Role.parse("super_admin")).contains(Role.SUPER_ADMIN);
        assertThat(Role.parse(" Admin ")).contains(Role.ADMIN);
        assertThat(Role.parse("super-admin")).contains(Role.SUPER_ADMIN);
        assertThat(Role.parse("USER")).contains(Role.USER);
    }

    @Test
    void unknownOrBlankIsEmpty() {
        assertThat(Role.parse(null)).isEmpty();
        assertThat(Role.parse("  ")).isEmpty();
        assertThat(Role.parse("root")).isEmpty();
    }

    @Test
    void claimIsLowercaseName() {
        assertThat(Role.SUPER_ADMIN.claim()).isEqualTo("super_admin");
        assertThat(Role.parse(Role.ADMIN.claim())).contains(Role.ADMIN);
    }

    @Test
    void actorRequiresIdAndRole() {
        assertThatThrownBy(() -> new Actor(null, Role.USER)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Actor(UUID.randomUUID(), null)).isInstanceOf(NullPointerException.class);
        assertThat(new Actor(UUID.randomUUID(), Role.ADMIN).hasRole(Role.ADMIN)).isTrue();
    }
}
