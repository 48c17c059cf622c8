package uk.gegc.learnpath.features.content.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.features.content.api.dto.ContentListQuery;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeDto;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeRequest;
import uk.gegc.learnpath.features.content.api.dto.ContentSortField;
import uk.gegc.learnpath.features.content.application.ContentService;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.model.Difficulty;

import java.util.List;
import java.util.UUID;

@Tag(name = "Content", description = "Learning paths, courses, modules, lessons and challenges")
@RestController
@RequestMapping("/api/v1/content/{kind}")
@RequiredArgsConstructor
@Validated
public class ContentController {

    private final ContentService contentService;

    @Operation(summary = "List content of one kind", description = "Optionally filtered by parent, status, difficulty and title search.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching nodes returned"),
            @ApiResponse(responseCode = "400", description = "Invalid filter",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<List<ContentNodeDto>> list(
            @Parameter(description = "Content kind, e.g. paths, courses, modules, lessons, challenges", example = "courses")
            @PathVariable ContentKind kind,

            @Parameter(in = ParameterIn.QUERY, description = "Parent node id")
            @RequestParam(name = "parentId", required = false) UUID parentId,

            @Parameter(in = ParameterIn.QUERY, description = "Statuses to include")
            @RequestParam(name = "status", required = false) List<ContentStatus> statuses,

            @RequestParam(name = "difficulty", required = false) Difficulty difficulty,

            @Parameter(in = ParameterIn.QUERY, description = "Case-insensitive title fragment")
            @RequestParam(name = "search", required = false) String search,

            @RequestParam(name = "sort", defaultValue = "SORT_ORDER") ContentSortField sort,

            @RequestParam(name = "ascending", defaultValue = "true") boolean ascending,

            @Min(1) @Max(100) @RequestParam(name = "limit", required = false) Integer limit,

            @Min(0) @RequestParam(name = "offset", required = false) Integer offset
    ) {
        ContentListQuery query = new ContentListQuery(parentId, statuses, difficulty, search, sort, ascending, limit, offset);
        return ResponseEntity.ok(contentService.list(kind, query));
    }

    @Operation(summary = "Get a content node by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Node returned"),
            @ApiResponse(responseCode = "404", description = "Node not found or not visible",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{id}")
    public ResponseEntity<ContentNodeDto> get(@PathVariable ContentKind kind, @PathVariable UUID id) {
        return ResponseEntity.ok(contentService.get(kind, id));
    }

    @Operation(summary = "Create a content node", description = "New nodes start as DRAFT. Requires content:create.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Node created"),
            @ApiResponse(responseCode = "404", description = "Parent not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Slug already used by a sibling",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<ContentNodeDto> create(@PathVariable ContentKind kind,
                                                 @RequestBody @Valid ContentNodeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(contentService.create(kind, request));
    }

    @Operation(
            summary = "Update a content node",
            description = "Partial update. Unpublishing or archiving cascades to every descendant; publishing requires content:publish."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Node updated"),
            @ApiResponse(responseCode = "404", description = "Node not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Slug conflict or unpublished parent",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Cascade failed part way",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PatchMapping("/{id}")
    public ResponseEntity<ContentNodeDto> update(@PathVariable ContentKind kind,
                                                 @PathVariable UUID id,
                                                 @RequestBody @Valid ContentNodeRequest request) {
        return ResponseEntity.ok(contentService.update(kind, id, request));
    }
}
