package com.jobly.board.auth;

import com.jobly.board.error.UnauthorizedException;
import org.springframework.stereotype.Component;

/**
 * Decides whether a caller holds a capability. Stateless; the identity is whatever the token
 * codec produced for this request, {@code null} when there was no usable token.
 */
@Component
public class AuthorizationPolicy {

    public boolean permits(Capability required, IdentityClaim identity, String routeSubjectId) {
        if (required == null || required == Capability.PUBLIC) {
            return true;
        }
        if (identity == null || identity.subjectId() == null) {
            return false;
        }
        return switch (required) {
            case AUTHENTICATED -> true;
            case ADMIN -> identity.isAdmin();
            case ADMIN_OR_SELF -> identity.isAdmin() || identity.subjectId().equals(routeSubjectId);
            default -> false;
        };
    }

    /** Throws {@link UnauthorizedException} unless {@link #permits} holds. */
    public void check(Capability required, IdentityClaim identity, String routeSubjectId) {
        if (!permits(required, identity, routeSubjectId)) {
            throw new UnauthorizedException();
        }
    }
}
