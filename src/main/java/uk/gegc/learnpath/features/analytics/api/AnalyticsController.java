package uk.gegc.learnpath.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.learnpath.features.analytics.api.dto.PlatformSummaryDto;
import uk.gegc.learnpath.features.analytics.api.dto.UserLearningStatsDto;
import uk.gegc.learnpath.features.analytics.application.AnalyticsService;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;

@Tag(name = "Analytics", description = "Platform and personal learning statistics")
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Platform summary",
            description = "Users, content, certificates, XP distribution, top performers, path enrollment and recent completions.")
    @GetMapping("/summary")
    @PreAuthorize("hasAuthority('analytics:read')")
    public ResponseEntity<PlatformSummaryDto> summary() {
        return ResponseEntity.ok(analyticsService.getPlatformSummary());
    }

    @Operation(summary = "My learning statistics")
    @GetMapping("/users/me")
    @PreAuthorize("hasAuthority('progress:read')")
    public ResponseEntity<UserLearningStatsDto> myStats() {
        return ResponseEntity.ok(analyticsService.getUserLearningStats(currentUserResolver.requireCurrentUser().id()));
    }
}
