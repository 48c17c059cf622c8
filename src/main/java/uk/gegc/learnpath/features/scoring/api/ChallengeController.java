package uk.gegc.learnpath.features.scoring.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.scoring.api.dto.ChallengeResult;
import uk.gegc.learnpath.features.scoring.api.dto.ChallengeSubmissionRequest;
import uk.gegc.learnpath.features.scoring.application.ChallengeSubmissionService;

import java.util.UUID;

@Tag(name = "Challenges", description = "Challenge submissions and grading")
@RestController
@RequestMapping("/api/v1/challenges")
@RequiredArgsConstructor
@Validated
public class ChallengeController {

    private final ChallengeSubmissionService submissionService;

    @Operation(
            summary = "Submit answers to a challenge",
            description = "Grades the answers, records the attempt and awards XP. Open-text answers are graded by the scoring model when it is available."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Submission graded",
                    content = @Content(schema = @Schema(implementation = ChallengeResult.class))),
            @ApiResponse(responseCode = "400", description = "Invalid answers payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Challenge not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "No attempts remaining or challenge not published",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{challengeId}/submissions")
    @PreAuthorize("hasAuthority('progress:update')")
    public ResponseEntity<ChallengeResult> submit(
            @PathVariable UUID challengeId,
            @Valid @RequestBody ChallengeSubmissionRequest request
    ) {
        return ResponseEntity.ok(submissionService.submit(challengeId, request));
    }
}
