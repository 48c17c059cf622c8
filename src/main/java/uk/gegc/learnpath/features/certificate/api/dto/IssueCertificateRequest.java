package uk.gegc.learnpath.features.certificate.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.UUID;

@Schema(name = "IssueCertificateRequest")
public record IssueCertificateRequest(
        @Schema(description = "Recipient; defaults to the caller")
        UUID userId,

        @Schema(description = "Learning path or course id", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Content id is required")
        UUID contentId,

        @Schema(description = "PATH or COURSE", example = "COURSE", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Content kind is required")
        ContentKind contentKind
) {
}
