package uk.gegc.learnpath.features.certificate.api.dto;

import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateType;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.UUID;

public record CertificateDto(
        UUID id,
        UUID userId,
        UUID contentId,
        ContentKind contentKind,
        CertificateType type,
        String title,
        String description,
        String verificationCode,
        CertificateStatus status,
        UUID issuedBy,
        Instant issuedAt,
        Instant revokedAt
) {
}
