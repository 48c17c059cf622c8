package uk.gegc.learnpath.features.ai.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MetaDescriptionRequest(
        @NotBlank(message = "Title cannot be blank")
        @Size(max = 200, message = "Title must be at most 200 characters long")
        String title,

        @NotBlank(message = "Content cannot be blank")
        String content
) {
}
