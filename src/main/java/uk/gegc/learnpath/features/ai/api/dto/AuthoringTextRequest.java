package uk.gegc.learnpath.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "AuthoringTextRequest", description = "Existing text to summarize, rewrite, polish or review")
public record AuthoringTextRequest(
        @Schema(description = "Markdown body of a lesson, module or course")
        @NotBlank(message = "Content cannot be blank")
        String content,

        @Schema(description = "Reader persona for rewrites; unknown values fall back to general", example = "product_manager")
        String audience,

        @Schema(description = "Target summary length in characters", example = "200")
        @Min(value = 20, message = "Summary length must be at least 20 characters")
        @Max(value = 2000, message = "Summary length must be at most 2000 characters")
        Integer maxLength
) {
}
