package uk.gegc.learnpath.features.certificate.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.certificate.domain.model.Certificate;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CertificateRepository extends JpaRepository<Certificate, UUID> {

    boolean existsByVerificationCode(String verificationCode);

    Optional<Certificate> findByVerificationCode(String verificationCode);

    Optional<Certificate> findFirstByUserIdAndContentIdAndContentKindAndStatus(UUID userId,
                                                                              UUID contentId,
                                                                              ContentKind contentKind,
                                                                              CertificateStatus status);

    List<Certificate> findAllByUserIdOrderByIssuedAtDesc(UUID userId);

    long countByUserIdAndStatus(UUID userId, CertificateStatus status);

    long countByStatus(CertificateStatus status);

    @Query("""
              SELECT c.contentId AS contentId, COUNT(c) AS issued
              FROM Certificate c
              WHERE c.contentKind = :kind
                AND c.status = uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus.ISSUED
              GROUP BY c.contentId
            """)
    List<ContentCertificateCount> countIssuedByContent(@Param("kind") ContentKind kind);

    interface ContentCertificateCount {
        UUID getContentId();

        long getIssued();
    }
}
