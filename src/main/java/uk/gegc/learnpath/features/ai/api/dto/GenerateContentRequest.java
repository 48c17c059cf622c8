package uk.gegc.learnpath.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "GenerateContentRequest", description = "Topic to draft new content about")
public record GenerateContentRequest(
        @Schema(description = "What the content should cover", example = "Event-driven architecture")
        @NotBlank(message = "Topic cannot be blank")
        @Size(max = 500, message = "Topic must be at most 500 characters long")
        String topic,

        @Schema(description = "Reader persona; unknown values fall back to general", example = "founder")
        String audience,

        @Schema(description = "lesson, module or course; lesson when omitted", example = "lesson")
        String kind
) {
}
