package uk.gegc.learnpath.features.certificate.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateDto;
import uk.gegc.learnpath.features.certificate.api.dto.CertificateVerificationDto;
import uk.gegc.learnpath.features.certificate.application.CompletionChecker;
import uk.gegc.learnpath.features.certificate.config.CertificateProperties;
import uk.gegc.learnpath.features.certificate.domain.model.Certificate;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateType;
import uk.gegc.learnpath.features.certificate.domain.repository.CertificateRepository;
import uk.gegc.learnpath.features.certificate.infra.VerificationCodeGenerator;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.Course;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.features.user.domain.repository.UserProfileRepository;
import uk.gegc.learnpath.shared.cache.CacheInvalidator;
import uk.gegc.learnpath.shared.cache.CacheProperties;
import uk.gegc.learnpath.shared.cache.TtlCache;
import uk.gegc.learnpath.shared.exception.CertificateNotEarnedException;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ForbiddenException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.UserRole;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CertificateServiceImpl Tests")
class CertificateServiceImplTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");

    @Mock
    private CertificateRepository certificateRepository;
    @Mock
    private UserProfileRepository userProfileRepository;
    @Mock
    private ContentNodeRegistry registry;
    @Mock
    private CompletionChecker completionChecker;
    @Mock
    private CurrentUserResolver currentUserResolver;

    private TtlCache cache;
    private CertificateServiceImpl service;

    private final UUID learnerId = UUID.randomUUID();
    private final UUID courseId = UUID.randomUUID();
    private Course course;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        cache = new TtlCache(clock);
        service = new CertificateServiceImpl(certificateRepository, userProfileRepository, registry, completionChecker,
                new VerificationCodeGenerator(new CertificateProperties()), cache, new CacheProperties(),
                new CacheInvalidator(cache), currentUserResolver, new AccessPolicy(), clock);

        course = new Course();
        course.setId(courseId);
        course.setTitle("Spring Boot Fundamentals");
        lenient().when(certificateRepository.save(any(Certificate.class))).thenAnswer(inv -> {
            Certificate c = inv.getArgument(0);
            if (c.getId() == null) {
                c.setId(UUID.randomUUID());
            }
            return c;
        });
    }

    private void actAs(UUID id, UserRole role) {
        lenient().when(currentUserResolver.requireCurrentUser()).thenReturn(new CurrentUser(id, role));
    }

    @Nested
    @DisplayName("issueCertificate")
    class Issue {

        @Test
        @DisplayName("learner who finished the course receives a certificate")
        void issuesToSelf() {
            actAs(learnerId, UserRole.USER);
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    learnerId, courseId, ContentKind.COURSE, CertificateStatus.ISSUED)).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);
            when(certificateRepository.existsByVerificationCode(anyString())).thenReturn(false);

            Optional<CertificateDto> result = service.issueCertificate(null, courseId, ContentKind.COURSE);

            assertThat(result).isPresent();
            CertificateDto dto = result.get();
            assertThat(dto.userId()).isEqualTo(learnerId);
            assertThat(dto.type()).isEqualTo(CertificateType.COMPLETION);
            assertThat(dto.status()).isEqualTo(CertificateStatus.ISSUED);
            assertThat(dto.title()).isEqualTo("Spring Boot Fundamentals");
            assertThat(dto.description()).isEqualTo("Awarded for completing Spring Boot Fundamentals");
            assertThat(dto.issuedAt()).isEqualTo(NOW);
            assertThat(dto.verificationCode()).matches("[A-Z0-9]{3}(-[A-Z0-9]{3}){3}");
        }

        @Test
        @DisplayName("existing active certificate means nothing new is issued")
        void alreadyHeld() {
            actAs(learnerId, UserRole.USER);
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    learnerId, courseId, ContentKind.COURSE, CertificateStatus.ISSUED))
                    .thenReturn(Optional.of(new Certificate()));

            assertThat(service.issueCertificate(learnerId, courseId, ContentKind.COURSE)).isEmpty();
            verify(certificateRepository, never()).save(any());
            verifyNoInteractions(completionChecker);
        }

        @Test
        @DisplayName("unfinished content is refused")
        void notEarned() {
            actAs(learnerId, UserRole.USER);
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(false);

            assertThatThrownBy(() -> service.issueCertificate(learnerId, courseId, ContentKind.COURSE))
                    .isInstanceOf(CertificateNotEarnedException.class);
        }

        @Test
        @DisplayName("missing content is NotFound")
        void missingContent() {
            actAs(learnerId, UserRole.USER);
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.issueCertificate(learnerId, courseId, ContentKind.COURSE))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("learners cannot issue certificates to someone else")
        void otherUserForbidden() {
            actAs(learnerId, UserRole.USER);

            assertThatThrownBy(() -> service.issueCertificate(UUID.randomUUID(), courseId, ContentKind.COURSE))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("admins issue on behalf of a learner and are recorded as issuer")
        void adminIssuesForLearner() {
            UUID adminId = UUID.randomUUID();
            actAs(adminId, UserRole.ADMIN);
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);

            CertificateDto dto = service.issueCertificate(learnerId, courseId, ContentKind.COURSE).orElseThrow();

            assertThat(dto.userId()).isEqualTo(learnerId);
            assertThat(dto.issuedBy()).isEqualTo(adminId);
        }

        @Test
        @DisplayName("modules are not certifiable")
        void moduleRejected() {
            actAs(learnerId, UserRole.USER);

            assertThatThrownBy(() -> service.issueCertificate(learnerId, UUID.randomUUID(), ContentKind.MODULE))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("issuing drops the learner's cached certificate list")
        void invalidatesUserCertificates() {
            actAs(learnerId, UserRole.USER);
            cache.getOrLoad("user_certificates_" + learnerId, () -> List.of(), Duration.ofMinutes(2));
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);

            service.issueCertificate(learnerId, courseId, ContentKind.COURSE);

            assertThat(cache.stats().keys()).isEmpty();
        }
    }

    @Nested
    @DisplayName("awardIfCompleted")
    class Award {

        @Test
        @DisplayName("stays silent when the content is not finished")
        void notFinished() {
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(false);

            assertThat(service.awardIfCompleted(learnerId, courseId, ContentKind.COURSE)).isEmpty();
            verify(certificateRepository, never()).save(any());
        }

        @Test
        @DisplayName("system awards carry no issuer")
        void systemIssuer() {
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);

            CertificateDto dto = service.awardIfCompleted(learnerId, courseId, ContentKind.COURSE).orElseThrow();

            assertThat(dto.issuedBy()).isNull();
            verifyNoInteractions(currentUserResolver);
        }

        @Test
        @DisplayName("a certificate inserted concurrently for the same course surfaces as a Conflict")
        void concurrentAward() {
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);
            doThrow(new DataIntegrityViolationException("uk_certificates_active_key"))
                    .when(certificateRepository).flush();

            assertThatThrownBy(() -> service.awardIfCompleted(learnerId, courseId, ContentKind.COURSE))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining(courseId.toString());
        }

        @Test
        @DisplayName("an awarded certificate claims the learner's active slot for that course")
        void activeKeySet() {
            when(certificateRepository.findFirstByUserIdAndContentIdAndContentKindAndStatus(
                    any(), any(), any(), any())).thenReturn(Optional.empty());
            when(registry.find(ContentKind.COURSE, courseId)).thenReturn(Optional.of(course));
            when(completionChecker.isCompleted(learnerId, courseId, ContentKind.COURSE)).thenReturn(true);

            service.awardIfCompleted(learnerId, courseId, ContentKind.COURSE);

            verify(certificateRepository).save(argThat(c ->
                    Certificate.activeKey(learnerId, ContentKind.COURSE, courseId).equals(c.getActiveKey())));
        }
    }

    @Nested
    @DisplayName("revoke and verify")
    class RevokeAndVerify {

        @Test
        @DisplayName("revoked certificates verify as invalid")
        void revokeThenVerify() {
            UUID adminId = UUID.randomUUID();
            actAs(adminId, UserRole.ADMIN);
            Certificate certificate = issued("ABC-DEF-GHJ-123");
            when(certificateRepository.findById(certificate.getId())).thenReturn(Optional.of(certificate));
            when(certificateRepository.findByVerificationCode("ABC-DEF-GHJ-123")).thenReturn(Optional.of(certificate));
            UserProfile profile = new UserProfile();
            profile.setId(learnerId);
            profile.setDisplayName("Ada Lovelace");
            when(userProfileRepository.findById(learnerId)).thenReturn(Optional.of(profile));

            CertificateDto revoked = service.revokeCertificate(certificate.getId());
            CertificateVerificationDto verification = service.verify(" abc-def-ghj-123 ");

            assertThat(revoked.status()).isEqualTo(CertificateStatus.REVOKED);
            assertThat(certificate.getActiveKey()).isNull();
            assertThat(revoked.revokedAt()).isEqualTo(NOW);
            assertThat(verification.valid()).isFalse();
            assertThat(verification.holderName()).isEqualTo("Ada Lovelace");
        }

        @Test
        @DisplayName("revoking twice leaves the first revocation in place")
        void revokeIdempotent() {
            actAs(UUID.randomUUID(), UserRole.ADMIN);
            Certificate certificate = issued("AAA-BBB-CCC-DDD");
            certificate.setStatus(CertificateStatus.REVOKED);
            Instant earlier = NOW.minusSeconds(3600);
            certificate.setRevokedAt(earlier);
            when(certificateRepository.findById(certificate.getId())).thenReturn(Optional.of(certificate));

            CertificateDto dto = service.revokeCertificate(certificate.getId());

            assertThat(dto.revokedAt()).isEqualTo(earlier);
            verify(certificateRepository, never()).save(any());
        }

        @Test
        @DisplayName("only holders of the revoke permission may revoke")
        void managerCannotRevoke() {
            actAs(UUID.randomUUID(), UserRole.CONTENT_MANAGER);

            assertThatThrownBy(() -> service.revokeCertificate(UUID.randomUUID()))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("unknown codes are NotFound")
        void unknownCode() {
            when(certificateRepository.findByVerificationCode("ZZZ-ZZZ-ZZZ-ZZZ")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.verify("ZZZ-ZZZ-ZZZ-ZZZ"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("verified certificates are served from cache")
        void verifyCached() {
            Certificate certificate = issued("QWE-RTY-UIO-P12");
            when(certificateRepository.findByVerificationCode("QWE-RTY-UIO-P12")).thenReturn(Optional.of(certificate));
            when(userProfileRepository.findById(learnerId)).thenReturn(Optional.empty());

            service.verify("QWE-RTY-UIO-P12");
            CertificateVerificationDto second = service.verify("QWE-RTY-UIO-P12");

            assertThat(second.valid()).isTrue();
            assertThat(second.holderName()).isNull();
            verify(certificateRepository, times(1)).findByVerificationCode("QWE-RTY-UIO-P12");
        }
    }

    private Certificate issued(String code) {
        Certificate certificate = new Certificate();
        certificate.setId(UUID.randomUUID());
        certificate.setUserId(learnerId);
        certificate.setContentId(courseId);
        certificate.setContentKind(ContentKind.COURSE);
        certificate.setType(CertificateType.COMPLETION);
        certificate.setTitle("Spring Boot Fundamentals");
        certificate.setVerificationCode(code);
        certificate.setStatus(CertificateStatus.ISSUED);
        certificate.setActiveKey(Certificate.activeKey(learnerId, ContentKind.COURSE, courseId));
        certificate.setIssuedAt(NOW.minusSeconds(86400));
        return certificate;
    }
}
