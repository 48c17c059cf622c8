package uk.gegc.learnpath.shared.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static uk.gegc.learnpath.shared.security.PermissionName.*;

public enum UserRole {
    USER("user", EnumSet.of(PROGRESS_READ, PROGRESS_UPDATE)),
    CONTENT_MANAGER("content_manager", EnumSet.of(
            CONTENT_CREATE, CONTENT_UPDATE, ANALYTICS_READ, PROGRESS_READ, PROGRESS_UPDATE)),
    ADMIN("admin", EnumSet.allOf(PermissionName.class));

    private final String claimValue;
    private final Set<PermissionName> permissions;

    UserRole(String claimValue, Set<PermissionName> permissions) {
        this.claimValue = claimValue;
        this.permissions = permissions;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public Set<PermissionName> getPermissions() {
        return EnumSet.copyOf(permissions);
    }

    public boolean has(PermissionName permission) {
        return permissions.contains(permission);
    }

    /**
     * Maps a token role claim to a role; absent or unknown claims resolve to {@link #USER}.
     */
    public static UserRole fromClaim(String claim) {
        if (claim == null || claim.isBlank()) {
            return USER;
        }
        String normalized = claim.trim().toLowerCase(Locale.ROOT);
        for (UserRole role : values()) {
            if (role.claimValue.equals(normalized)) {
                return role;
            }
        }
        return USER;
    }
}
