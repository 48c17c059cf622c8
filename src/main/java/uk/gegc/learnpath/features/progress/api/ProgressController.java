package uk.gegc.learnpath.features.progress.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.progress.api.dto.ProgressResult;
import uk.gegc.learnpath.features.progress.api.dto.UserProgressDto;
import uk.gegc.learnpath.features.progress.api.dto.UserXpDto;
import uk.gegc.learnpath.features.progress.api.dto.XpLevelDto;
import uk.gegc.learnpath.features.progress.application.ProgressService;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;

import java.util.List;
import java.util.UUID;

@Tag(name = "Progress", description = "Learner progress, XP and levels")
@RestController
@RequestMapping("/api/v1/progress")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressService progressService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Get my progress", description = "All tracked items, or a single item when contentId is given.")
    @GetMapping("/me")
    @PreAuthorize("hasAuthority('progress:read')")
    public ResponseEntity<List<UserProgressDto>> myProgress(
            @Parameter(in = ParameterIn.QUERY, description = "Restrict to one content item")
            @RequestParam(name = "contentId", required = false) UUID contentId
    ) {
        UUID userId = currentUserResolver.requireCurrentUser().id();
        return ResponseEntity.ok(progressService.getUserProgress(userId, contentId));
    }

    @Operation(summary = "Mark a lesson as completed", description = "Awards the lesson's XP once; repeated calls are harmless.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Progress recorded"),
            @ApiResponse(responseCode = "404", description = "Lesson not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Lesson not published",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/lessons/{lessonId}/complete")
    @PreAuthorize("hasAuthority('progress:update')")
    public ResponseEntity<ProgressResult> completeLesson(@PathVariable UUID lessonId) {
        UUID userId = currentUserResolver.requireCurrentUser().id();
        return ResponseEntity.ok(progressService.completeLesson(userId, lessonId));
    }

    @Operation(summary = "Get my XP, level and streaks")
    @GetMapping("/me/xp")
    @PreAuthorize("hasAuthority('progress:read')")
    public ResponseEntity<UserXpDto> myXp() {
        UUID userId = currentUserResolver.requireCurrentUser().id();
        return ResponseEntity.ok(progressService.getUserXp(userId));
    }

    @Operation(summary = "List XP levels")
    @GetMapping("/levels")
    public ResponseEntity<List<XpLevelDto>> levels() {
        return ResponseEntity.ok(progressService.getXpLevels());
    }
}
