package uk.gegc.learnpath.features.certificate.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateDto;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateVerificationDto;
import uk.gegc.learnpath.features.certificate.application.CertificateService;
import uk.gegc.learnpath.features.certificate.application.CompletionChecker;
import uk.gegc.learnpath.features.certificate.domain.model.Certificate;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateType;
import uk.gegc.learnpath.features.certificate.domain.repository.CertificateRepository;
import uk.gegc.learnpath.features.certificate.infra.VerificationCodeGenerator;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.features.user.domain.repository.UserProfileRepository;
import uk.gegc.learnpath.shared.cache.CacheInvalidator;
import uk.gegc.learnpath.shared.cache.CacheKeys;
import uk.gegc.learnpath.shared.cache.CacheProperties;
import uk.gegc.learnpath.shared.cache.TtlCache;
import uk.gegc.learnpath.shared.exception.CertificateNotEarnedException;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.PermissionName;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateServiceImpl implements CertificateService {

    private final CertificateRepository certificateRepository;
    private final UserProfileRepository userProfileRepository;
    private final ContentNodeRegistry registry;
    private final CompletionChecker completionChecker;
    private final VerificationCodeGenerator codeGenerator;
    private final TtlCache cache;
    private final CacheProperties cacheProperties;
    private final CacheInvalidator cacheInvalidator;
    private final CurrentUserResolver currentUserResolver;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<CertificateDto> issueCertificate(UUID userId, UUID contentId, ContentKind kind) {
        CurrentUser actor = currentUserResolver.requireCurrentUser();
        UUID recipient = userId != null ? userId : actor.id();
        accessPolicy.requireSelfOrAny(actor, recipient, PermissionName.CERTIFICATES_ISSUE);
        requireCertifiable(kind);

        if (hasActiveCertificate(recipient, contentId, kind)) {
            log.debug("User {} already holds a certificate for {} {}", recipient, kind.getKey(), contentId);
            return Optional.empty();
        }
        ContentNode content = registry.find(kind, contentId)
                .orElseThrow(() -> new ResourceNotFoundException(displayName(kind), contentId));
        if (!completionChecker.isCompleted(recipient, contentId, kind)) {
            throw new CertificateNotEarnedException(recipient, kind.getKey(), contentId);
        }
        return Optional.of(issue(recipient, content, actor.id()));
    }

    @Override
    @Transactional
    public Optional<CertificateDto> awardIfCompleted(UUID userId, UUID contentId, ContentKind kind) {
        requireCertifiable(kind);
        if (hasActiveCertificate(userId, contentId, kind)) {
            return Optional.empty();
        }
        Optional<ContentNode> content = registry.find(kind, contentId);
        if (content.isEmpty() || !completionChecker.isCompleted(userId, contentId, kind)) {
            return Optional.empty();
        }
        return Optional.of(issue(userId, content.get(), null));
    }

    @Override
    @Transactional
    public CertificateDto revokeCertificate(UUID certificateId) {
        CurrentUser actor = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(actor, PermissionName.CERTIFICATES_REVOKE);

        Certificate certificate = certificateRepository.findById(certificateId)
                .orElseThrow(() -> new ResourceNotFoundException("Certificate", certificateId));
        if (certificate.isRevoked()) {
            return toDto(certificate);
        }

        certificate.setStatus(CertificateStatus.REVOKED);
        certificate.setRevokedBy(actor.id());
        certificate.setRevokedAt(clock.instant());
        certificate.setActiveKey(null);
        Certificate saved = certificateRepository.save(certificate);
        invalidate(saved);
        log.info("Certificate {} ({}) revoked by {}", saved.getId(), saved.getVerificationCode(), actor.id());
        return toDto(saved);
    }

    @Override
    public List<CertificateDto> getUserCertificates(UUID userId) {
        return cache.getOrLoad(CacheKeys.userCertificates(userId),
                () -> certificateRepository.findAllByUserIdOrderByIssuedAtDesc(userId).stream()
                        .map(CertificateServiceImpl::toDto)
                        .toList(),
                cacheProperties.getCertificateTtl());
    }

    @Override
    public CertificateVerificationDto verify(String verificationCode) {
        if (verificationCode == null || verificationCode.isBlank()) {
            throw new ValidationException("Verification code is required");
        }
        String code = verificationCode.trim().toUpperCase(Locale.ROOT);
        return cache.getOrLoad(CacheKeys.certificate(code), () -> {
            Certificate certificate = certificateRepository.findByVerificationCode(code)
                    .orElseThrow(() -> new ResourceNotFoundException("Certificate " + code + " not found"));
            String holder = userProfileRepository.findById(certificate.getUserId())
                    .map(UserProfile::getDisplayName)
                    .orElse(null);
            return new CertificateVerificationDto(
                    certificate.getVerificationCode(),
                    certificate.getTitle(),
                    holder,
                    certificate.getContentKind(),
                    certificate.getStatus(),
                    certificate.getIssuedAt(),
                    certificate.getRevokedAt(),
                    !certificate.isRevoked()
            );
        }, cacheProperties.getCertificateTtl());
    }

    @Override
    public boolean isCompleted(UUID userId, UUID contentId, ContentKind kind) {
        return completionChecker.isCompleted(userId, contentId, kind);
    }

    private CertificateDto issue(UUID userId, ContentNode content, UUID issuedBy) {
        Instant now = clock.instant();
        Certificate certificate = new Certificate();
        certificate.setUserId(userId);
        certificate.setContentId(content.getId());
        certificate.setContentKind(content.getKind());
        certificate.setType(CertificateType.COMPLETION);
        certificate.setTitle(content.getTitle());
        certificate.setDescription("Awarded for completing " + content.getTitle());
        certificate.setVerificationCode(codeGenerator.generateUnique(certificateRepository::existsByVerificationCode));
        certificate.setStatus(CertificateStatus.ISSUED);
        certificate.setActiveKey(Certificate.activeKey(userId, content.getKind(), content.getId()));
        certificate.setIssuedBy(issuedBy);
        certificate.setIssuedAt(now);

        Certificate saved;
        try {
            saved = certificateRepository.save(certificate);
            certificateRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("User " + userId + " already holds an active certificate for "
                    + content.getKind().getKey() + " " + content.getId(), ex);
        }
        invalidate(saved);
        log.info("Issued certificate {} to user {} for {} {}",
                saved.getVerificationCode(), userId, content.getKind().getKey(), content.getId());
        return toDto(saved);
    }

    private boolean hasActiveCertificate(UUID userId, UUID contentId, ContentKind kind) {
        return certificateRepository
                .findFirstByUserIdAndContentIdAndContentKindAndStatus(userId, contentId, kind, CertificateStatus.ISSUED)
                .isPresent();
    }

    private void invalidate(Certificate certificate) {
        cacheInvalidator.invalidateAfterCommit(
                CacheKeys.CERTIFICATE_PREFIX,
                CacheKeys.userCertificates(certificate.getUserId()),
                CacheKeys.userStats(certificate.getUserId()),
                CacheKeys.STATS
        );
    }

    private static void requireCertifiable(ContentKind kind) {
        if (kind == null || !kind.isCertifiable()) {
            throw new ValidationException("Certificates are issued for learning paths and courses only");
        }
    }

    private static String displayName(ContentKind kind) {
        return kind == ContentKind.PATH ? "Learning path" : "Course";
    }

    static CertificateDto toDto(Certificate certificate) {
        return new CertificateDto(
                certificate.getId(),
                certificate.getUserId(),
                certificate.getContentId(),
                certificate.getContentKind(),
                certificate.getType(),
                certificate.getTitle(),
                certificate.getDescription(),
                certificate.getVerificationCode(),
                certificate.getStatus(),
                certificate.getIssuedBy(),
                certificate.getIssuedAt(),
                certificate.getRevokedAt()
        );
    }
}
