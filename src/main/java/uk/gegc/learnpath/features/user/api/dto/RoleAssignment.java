package uk.gegc.learnpath.features.user.api.dto;

import jakarta.validation.constraints.NotNull;
import uk.gegc.learnpath.shared.security.UserRole;

import java.util.UUID;

public record RoleAssignment(
        @NotNull(message = "User id is required")
        UUID userId,

        @NotNull(message = "Role is required")
        UserRole role
) {
}
