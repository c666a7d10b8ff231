package com.emcit.application.guard;

import com.emcit.domain.access.Actor;
import com.emcit.domain.access.Role;
import com.emcit.domain.access.UnauthorizedException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Role check placed in front of every mutating or sensitive-read operation.
 *
 * Rules:
 * - No actor (no session) never passes.
 * - Empty required set never passes.
 */
public final class AccessGate {

    public static final Set<Role> ADMINS = Collections.unmodifiableSet(EnumSet.of(Role.ADMIN, Role.SUPER_ADMIN));
    public static final Set<Role> SUPER_ADMINS = Collections.unmodifiableSet(EnumSet.of(Role.SUPER_ADMIN));
    public static final Set<Role> ANY_ROLE = Collections.unmodifiableSet(EnumSet.allOf(Role.class));

    private AccessGate() {}

    public static boolean authorize(Actor actor, Set<Role> requiredRoles) {
        if (actor == null || actor.role() == null) return false;
        if (requiredRoles == null || requiredRoles.isEmpty()) return false;
        return requiredRoles.contains(actor.role());
    }

    /**
     * @throws UnauthorizedException if {@link #authorize} fails
     */
    public static Actor require(Actor actor, Set<Role> requiredRoles) {
        if (!authorize(actor, requiredRoles)) {
            throw new UnauthorizedException();
        }
        return actor;
    }
}
