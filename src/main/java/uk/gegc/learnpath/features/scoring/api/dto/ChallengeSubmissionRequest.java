package uk.gegc.learnpath.features.scoring.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(name = "ChallengeSubmissionRequest", description = "Answers keyed by zero-based question index")
public record ChallengeSubmissionRequest(
        @Schema(description = "Answer per question index; missing questions are graded incorrect",
                example = "{\"0\": 1, \"1\": [0, 2], \"2\": \"A closure captures its scope\"}")
        @NotNull(message = "Answers must not be null")
        Map<Integer, JsonNode> answers,

        @Schema(description = "Minutes spent on this attempt", example = "12")
        @Min(value = 0, message = "Time spent must not be negative")
        @Max(value = 1440, message = "Time spent must not exceed 1440 minutes")
        Integer timeSpentMinutes
) {
}
