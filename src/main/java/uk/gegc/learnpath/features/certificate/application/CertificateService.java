package uk.gegc.learnpath.features.certificate.application;

import uk.gegc.learnpath.features.certificate.api.dto.CertificateDto;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateVerificationDto;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CertificateService {

    /**
     * Issues a certificate on behalf of the current user.
     *
     * @return empty when the user already holds a non-revoked certificate for the content
     * @throws uk.gegc.learnpath.shared.exception.CertificateNotEarnedException when the content is not completed
     */
    Optional<CertificateDto> issueCertificate(UUID userId, UUID contentId, ContentKind kind);

    /**
     * System path used after a completion: issues only when earned and not already held.
     */
    Optional<CertificateDto> awardIfCompleted(UUID userId, UUID contentId, ContentKind kind);

    CertificateDto revokeCertificate(UUID certificateId);

    List<CertificateDto> getUserCertificates(UUID userId);

    CertificateVerificationDto verify(String verificationCode);

    boolean isCompleted(UUID userId, UUID contentId, ContentKind kind);
}
