package uk.gegc.learnpath.features.certificate.api.dto;

import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;

/**
 * Public view of a certificate looked up by its verification code.
 *
 * @param valid false once the certificate has been revoked
 */
public record CertificateVerificationDto(
        String verificationCode,
        String title,
        String holderName,
        ContentKind contentKind,
        CertificateStatus status,
        Instant issuedAt,
        Instant revokedAt,
        boolean valid
) {
}
