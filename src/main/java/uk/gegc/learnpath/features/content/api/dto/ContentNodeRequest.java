package uk.gegc.learnpath.features.content.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import uk.gegc.learnpath.features.content.domain.model.ChallengeType;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.model.Difficulty;
import uk.gegc.learnpath.features.content.domain.model.LessonType;

import java.util.List;
import java.util.UUID;

/**
 * Create and partial-update payload for every content kind. Fields that do not
 * apply to the addressed kind are rejected; absent fields are left unchanged on update.
 */
@Schema(name = "ContentNodeRequest", description = "Fields of a learning path, course, module, lesson or challenge")
public record ContentNodeRequest(

        @Schema(description = "Parent node id; required on create for every kind except path")
        UUID parentId,

        @Schema(description = "Display title", example = "Intro to Java")
        @Size(min = 1, max = 200, message = "Title length must be between 1 and 200 characters")
        String title,

        @Schema(description = "URL slug, unique among siblings; derived from the title when omitted", example = "intro-to-java")
        @Size(max = 200, message = "Slug must be at most 200 characters long")
        @Pattern(regexp = "^[a-z0-9]+(?:-[a-z0-9]+)*$", message = "Slug may contain lowercase letters, digits and single hyphens")
        String slug,

        @Schema(description = "Lifecycle status; ignored on create", example = "PUBLISHED")
        ContentStatus status,

        @Schema(description = "Position among siblings")
        @Min(value = 0, message = "Sort order must not be negative")
        Integer sortOrder,

        @Size(max = 10000, message = "Description must be at most 10000 characters long")
        String description,

        @Size(max = 500, message = "Short description must be at most 500 characters long")
        String shortDescription,

        Difficulty difficulty,

        @Min(value = 0, message = "Estimated hours must not be negative")
        Integer estimatedHours,

        @Min(value = 0, message = "Estimated minutes must not be negative")
        Integer estimatedMinutes,

        Boolean featured,

        @Schema(description = "Lesson body in markdown")
        String content,

        @Size(max = 1000, message = "Summary must be at most 1000 characters long")
        String summary,

        @Min(value = 0, message = "XP reward must not be negative")
        @Max(value = 10000, message = "XP reward must be at most 10000")
        Integer xpReward,

        LessonType lessonType,

        @Size(max = 500, message = "Video URL must be at most 500 characters long")
        String videoUrl,

        ChallengeType challengeType,

        @Schema(description = "Challenge definition: {\"questions\":[...]}")
        JsonNode questions,

        @Schema(description = "Challenge solution: {\"answers\":[...]}")
        JsonNode solution,

        List<@Size(max = 1000) String> hints,

        @Min(value = 1, message = "Max attempts must be at least 1")
        Integer maxAttempts,

        @Min(value = 1, message = "Time limit must be at least 1 minute")
        Integer timeLimitMinutes
) {
}
