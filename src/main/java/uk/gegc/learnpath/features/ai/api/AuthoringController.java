package uk.gegc.learnpath.features.ai.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.ai.api.dto.*;
import uk.gegc.learnpath.features.ai.application.AuthoringService;
import uk.gegc.learnpath.features.ai.domain.model.Audience;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ai/authoring")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "AI Authoring", description = "Model-assisted summaries, rewrites and drafts for content authors")
public class AuthoringController {

    private final AuthoringService authoringService;

    @Operation(summary = "Whether the assistant is enabled, and the audiences it writes for")
    @GetMapping
    public ResponseEntity<AuthoringStatusDto> status() {
        List<AudienceDto> audiences = Arrays.stream(Audience.values())
                .map(audience -> new AudienceDto(audience.getKey(), audience.getLabel()))
                .toList();
        return ResponseEntity.ok(new AuthoringStatusDto(authoringService.isAvailable(), audiences));
    }

    @Operation(summary = "Summarize content")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary generated"),
            @ApiResponse(responseCode = "400", description = "Blank or oversized content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller cannot author content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Model failed after retries",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Assistant disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/summaries")
    public ResponseEntity<AuthoringResult> summarize(@Valid @RequestBody AuthoringTextRequest request) {
        return ResponseEntity.ok(authoringService.summarize(request.content(), request.maxLength()));
    }

    @Operation(summary = "Rewrite content for a reader persona")
    @PostMapping("/rewrites")
    public ResponseEntity<AuthoringResult> rewrite(@Valid @RequestBody AuthoringTextRequest request) {
        return ResponseEntity.ok(authoringService.rewriteForAudience(request.content(), Audience.fromKey(request.audience())));
    }

    @Operation(summary = "Improve clarity and grammar while keeping the markdown structure")
    @PostMapping("/improvements")
    public ResponseEntity<AuthoringResult> improve(@Valid @RequestBody AuthoringTextRequest request) {
        return ResponseEntity.ok(authoringService.improveWriting(request.content()));
    }

    @Operation(summary = "Draft a lesson, module outline or course overview")
    @PostMapping("/drafts")
    public ResponseEntity<AuthoringResult> generate(@Valid @RequestBody GenerateContentRequest request) {
        ContentKind kind = request.kind() == null || request.kind().isBlank() ? ContentKind.LESSON : ContentKind.fromKey(request.kind());
        log.debug("Draft requested: kind={}, audience={}", kind.getKey(), request.audience());
        return ResponseEntity.ok(authoringService.generateContent(request.topic(), Audience.fromKey(request.audience()), kind));
    }

    @Operation(summary = "Write an SEO meta description")
    @PostMapping("/meta-descriptions")
    public ResponseEntity<AuthoringResult> metaDescription(@Valid @RequestBody MetaDescriptionRequest request) {
        return ResponseEntity.ok(authoringService.generateMetaDescription(request.title(), request.content()));
    }

    @Operation(summary = "Suggest improvements to a lesson")
    @PostMapping("/suggestions")
    public ResponseEntity<Map<String, List<String>>> suggest(@Valid @RequestBody AuthoringTextRequest request) {
        return ResponseEntity.ok(Map.of("suggestions", authoringService.suggestImprovements(request.content())));
    }
}
