package uk.gegc.learnpath.features.certificate.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "certificates",
        indexes = @Index(name = "idx_certificates_user_content", columnList = "user_id, content_id, content_kind"))
public class Certificate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    /**
     * The learning path or course the certificate was awarded for.
     */
    @Column(name = "content_id", nullable = false, updatable = false)
    private UUID contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_kind", nullable = false, updatable = false, length = 20)
    private ContentKind contentKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "certificate_type", nullable = false, length = 20)
    private CertificateType type = CertificateType.COMPLETION;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "verification_code", nullable = false, unique = true, length = 15)
    private String verificationCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CertificateStatus status = CertificateStatus.ISSUED;

    /**
     * Set while the certificate is ISSUED and cleared on revocation; unique, so a learner holds at most
     * one active certificate per piece of content.
     */
    @Column(name = "active_key", unique = true, length = 100)
    private String activeKey;

    @Column(name = "issued_by")
    private UUID issuedBy;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "revoked_by")
    private UUID revokedBy;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static String activeKey(UUID userId, ContentKind contentKind, UUID contentId) {
        return userId + ":" + contentKind.name() + ":" + contentId;
    }

    public boolean isRevoked() {
        return status == CertificateStatus.REVOKED;
    }
}
