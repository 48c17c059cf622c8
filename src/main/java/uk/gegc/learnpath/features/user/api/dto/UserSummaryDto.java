package uk.gegc.learnpath.features.user.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.learnpath.shared.security.UserRole;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "UserSummaryDto", description = "A user profile as shown to administrators")
public record UserSummaryDto(
        UUID id,
        String displayName,
        String bio,
        @Schema(example = "CONTENT_MANAGER")
        UserRole role,
        Instant lastActiveAt,
        Instant createdAt
) {
}
