package uk.gegc.learnpath.features.user.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.user.api.dto.BatchRoleUpdateRequest;
import uk.gegc.learnpath.features.user.api.dto.UpdateUserRoleRequest;
import uk.gegc.learnpath.features.user.api.dto.UserRoleCountsDto;
import uk.gegc.learnpath.features.user.api.dto.UserSummaryDto;
import uk.gegc.learnpath.features.user.application.UserAdminService;
import uk.gegc.learnpath.shared.security.UserRole;

import java.util.List;
import java.util.UUID;

@Tag(name = "Admin - Users", description = "List users and manage their roles")
@RestController
@RequestMapping("/api/v1/admin/users")
@RequiredArgsConstructor
@Validated
public class UserAdminController {

    private final UserAdminService userAdminService;

    @Operation(summary = "List users", description = "Newest first. Filter by role, or page through everyone.")
    @GetMapping
    public ResponseEntity<List<UserSummaryDto>> list(
            @Parameter(description = "Only users holding this role")
            @RequestParam(name = "role", required = false) UserRole role,

            @Min(1) @Max(200) @RequestParam(name = "limit", required = false) Integer limit,

            @Min(0) @RequestParam(name = "offset", required = false) Integer offset
    ) {
        if (role != null) {
            return ResponseEntity.ok(userAdminService.getUsersByRole(role));
        }
        return ResponseEntity.ok(userAdminService.listUsers(limit, offset));
    }

    @Operation(summary = "Search users by display name or bio")
    @GetMapping("/search")
    public ResponseEntity<List<UserSummaryDto>> search(@RequestParam(name = "q") String query) {
        return ResponseEntity.ok(userAdminService.searchUsers(query));
    }

    @Operation(summary = "Number of users holding each role")
    @GetMapping("/role-counts")
    public ResponseEntity<UserRoleCountsDto> roleCounts() {
        return ResponseEntity.ok(userAdminService.countByRole());
    }

    @Operation(summary = "Change one user's role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Role updated"),
            @ApiResponse(responseCode = "400", description = "Missing role, or an administrator changing their own role",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Missing users:manage permission",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No such user profile",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{userId}/role")
    public ResponseEntity<UserSummaryDto> updateRole(@PathVariable UUID userId,
                                                     @Valid @RequestBody UpdateUserRoleRequest request) {
        return ResponseEntity.ok(userAdminService.updateUserRole(userId, request.role()));
    }

    @Operation(summary = "Change several users' roles at once", description = "All assignments are applied or none are.")
    @PutMapping("/roles")
    public ResponseEntity<List<UserSummaryDto>> batchUpdateRoles(@Valid @RequestBody BatchRoleUpdateRequest request) {
        return ResponseEntity.ok(userAdminService.batchUpdateUserRoles(request.assignments()));
    }
}
