package uk.gegc.learnpath.features.user.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import uk.gegc.learnpath.features.user.api.dto.RoleAssignment;
import uk.gegc.learnpath.features.user.api.dto.UserRoleCountsDto;
import uk.gegc.learnpath.features.user.api.dto.UserSummaryDto;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.features.user.domain.repository.UserProfileRepository;
import uk.gegc.learnpath.shared.exception.ForbiddenException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.UserRole;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserAdminServiceImpl Tests")
class UserAdminServiceImplTest {

    @Mock
    private UserProfileRepository userProfileRepository;
    @Mock
    private CurrentUserResolver currentUserResolver;

    private UserAdminServiceImpl service;
    private final UUID adminId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new UserAdminServiceImpl(userProfileRepository, currentUserResolver, new AccessPolicy());
        actAs(UserRole.ADMIN);
    }

    private void actAs(UserRole role) {
        lenient().when(currentUserResolver.requireCurrentUser()).thenReturn(new CurrentUser(adminId, role));
    }

    @Nested
    @DisplayName("updateUserRole")
    class UpdateRole {

        @Test
        @DisplayName("promotes a learner to content manager")
        void promote() {
            UserProfile learner = profile("Grace", UserRole.USER);
            when(userProfileRepository.findById(learner.getId())).thenReturn(Optional.of(learner));
            when(userProfileRepository.save(learner)).thenReturn(learner);

            UserSummaryDto dto = service.updateUserRole(learner.getId(), UserRole.CONTENT_MANAGER);

            assertThat(dto.role()).isEqualTo(UserRole.CONTENT_MANAGER);
            assertThat(learner.getRole()).isEqualTo(UserRole.CONTENT_MANAGER);
        }

        @Test
        @DisplayName("assigning the current role writes nothing")
        void sameRole_noWrite() {
            UserProfile manager = profile("Linus", UserRole.CONTENT_MANAGER);
            when(userProfileRepository.findById(manager.getId())).thenReturn(Optional.of(manager));

            service.updateUserRole(manager.getId(), UserRole.CONTENT_MANAGER);

            verify(userProfileRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknown users are NotFound")
        void unknown() {
            UUID id = UUID.randomUUID();
            when(userProfileRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.updateUserRole(id, UserRole.ADMIN))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("administrators cannot change their own role")
        void self_rejected() {
            assertThatThrownBy(() -> service.updateUserRole(adminId, UserRole.USER))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(userProfileRepository);
        }

        @Test
        @DisplayName("content managers cannot manage roles")
        void managerForbidden() {
            actAs(UserRole.CONTENT_MANAGER);

            assertThatThrownBy(() -> service.updateUserRole(UUID.randomUUID(), UserRole.ADMIN))
                    .isInstanceOf(ForbiddenException.class);
            verifyNoInteractions(userProfileRepository);
        }
    }

    @Nested
    @DisplayName("batchUpdateUserRoles")
    class Batch {

        @Test
        @DisplayName("applies every assignment and saves only real changes")
        void appliesAll() {
            UserProfile a = profile("Ada", UserRole.USER);
            UserProfile b = profile("Barbara", UserRole.ADMIN);
            when(userProfileRepository.findAllByIdIn(Set.of(a.getId(), b.getId()))).thenReturn(List.of(a, b));

            List<UserSummaryDto> result = service.batchUpdateUserRoles(List.of(
                    new RoleAssignment(a.getId(), UserRole.CONTENT_MANAGER),
                    new RoleAssignment(b.getId(), UserRole.ADMIN)));

            assertThat(result).extracting(UserSummaryDto::id).containsExactly(a.getId(), b.getId());
            assertThat(result).extracting(UserSummaryDto::role).containsExactly(UserRole.CONTENT_MANAGER, UserRole.ADMIN);
            verify(userProfileRepository).saveAll(List.of(a));
        }

        @Test
        @DisplayName("one unknown id rejects the whole batch")
        void unknownId_rejectsAll() {
            UserProfile a = profile("Ada", UserRole.USER);
            UUID ghost = UUID.randomUUID();
            when(userProfileRepository.findAllByIdIn(anyCollection())).thenReturn(List.of(a));

            assertThatThrownBy(() -> service.batchUpdateUserRoles(List.of(
                    new RoleAssignment(a.getId(), UserRole.ADMIN),
                    new RoleAssignment(ghost, UserRole.ADMIN))))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining(ghost.toString());
            assertThat(a.getRole()).isEqualTo(UserRole.USER);
            verify(userProfileRepository, never()).saveAll(any());
        }

        @Test
        @DisplayName("the same user twice is rejected")
        void duplicate_rejected() {
            UUID id = UUID.randomUUID();

            assertThatThrownBy(() -> service.batchUpdateUserRoles(List.of(
                    new RoleAssignment(id, UserRole.ADMIN),
                    new RoleAssignment(id, UserRole.USER))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("more than once");
        }

        @Test
        @DisplayName("a batch that includes the caller is rejected")
        void includesSelf_rejected() {
            assertThatThrownBy(() -> service.batchUpdateUserRoles(List.of(
                    new RoleAssignment(UUID.randomUUID(), UserRole.ADMIN),
                    new RoleAssignment(adminId, UserRole.USER))))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(userProfileRepository);
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("role counts add up to the total")
        void counts() {
            when(userProfileRepository.countByRole(UserRole.ADMIN)).thenReturn(2L);
            when(userProfileRepository.countByRole(UserRole.CONTENT_MANAGER)).thenReturn(5L);
            when(userProfileRepository.countByRole(UserRole.USER)).thenReturn(93L);

            UserRoleCountsDto counts = service.countByRole();

            assertThat(counts).isEqualTo(new UserRoleCountsDto(100, 2, 5, 93));
        }

        @Test
        @DisplayName("search trims the query and caps the result size")
        void search() {
            when(userProfileRepository.search(eq("ada"), any(Pageable.class))).thenReturn(List.of(profile("Ada", UserRole.USER)));

            assertThat(service.searchUsers("  ada ")).hasSize(1);
            verify(userProfileRepository).search(eq("ada"), argThat(p -> p.getPageSize() == UserAdminServiceImpl.SEARCH_LIMIT));
        }

        @Test
        @DisplayName("blank search queries are rejected")
        void blankSearch() {
            assertThatThrownBy(() -> service.searchUsers(" "))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("listing caps the page size")
        void listCapsLimit() {
            when(userProfileRepository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());

            service.listUsers(10_000, 40);

            verify(userProfileRepository).findAllByOrderByCreatedAtDesc(argThat(p ->
                    p.getPageSize() == UserAdminServiceImpl.MAX_LIMIT && p.getOffset() == 40));
        }
    }

    private static UserProfile profile(String name, UserRole role) {
        UserProfile profile = new UserProfile();
        profile.setId(UUID.randomUUID());
        profile.setDisplayName(name);
        profile.setRole(role);
        profile.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        return profile;
    }
}
