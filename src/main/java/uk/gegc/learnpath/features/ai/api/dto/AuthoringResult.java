package uk.gegc.learnpath.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "AuthoringResult", description = "Text produced by the authoring assistant")
public record AuthoringResult(
        @Schema(description = "Generated or rewritten text, markdown where the operation asks for it")
        String text,

        @Schema(description = "Model that produced the text", example = "gpt-4o-mini")
        String model,

        @Schema(description = "Round-trip latency in milliseconds", example = "1250")
        long latencyMs
) {
}
