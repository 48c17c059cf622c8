package uk.gegc.learnpath.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "BatchRoleUpdateRequest", description = "Role changes applied together; either all succeed or none do")
public record BatchRoleUpdateRequest(
        @NotEmpty(message = "At least one assignment is required")
        @Size(max = 100, message = "At most 100 assignments per request")
        List<@Valid RoleAssignment> assignments
) {
}
