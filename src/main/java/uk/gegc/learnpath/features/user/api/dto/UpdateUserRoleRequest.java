package uk.gegc.learnpath.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.learnpath.shared.security.UserRole;

@Schema(name = "UpdateUserRoleRequest", description = "New role for one user")
public record UpdateUserRoleRequest(
        @Schema(description = "USER, CONTENT_MANAGER or ADMIN", example = "CONTENT_MANAGER")
        @NotNull(message = "Role is required")
        UserRole role
) {
}
