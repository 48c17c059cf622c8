package uk.gegc.learnpath.shared.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated principal resolved from the bearer token.
 */
public record CurrentUser(UUID id, UserRole role) {

    public CurrentUser {
        Objects.requireNonNull(id, "id");
        role = role == null ? UserRole.USER : role;
    }

    public boolean has(PermissionName permission) {
        return role.has(permission);
    }
}
