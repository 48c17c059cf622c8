package uk.gegc.learnpath.features.user.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnpath.features.user.api.dto.RoleAssignment;
import uk.gegc.learnpath.features.user.api.dto.UserRoleCountsDto;
import uk.gegc.learnpath.features.user.api.dto.UserSummaryDto;
import uk.gegc.learnpath.features.user.application.UserAdminService;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.features.user.domain.repository.UserProfileRepository;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.query.OffsetBasedPageRequest;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.PermissionName;
import uk.gegc.learnpath.shared.security.UserRole;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserAdminServiceImpl implements UserAdminService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;
    static final int SEARCH_LIMIT = 50;

    private final UserProfileRepository userProfileRepository;
    private final CurrentUserResolver currentUserResolver;
    private final AccessPolicy accessPolicy;

    @Override
    @Transactional(readOnly = true)
    public List<UserSummaryDto> listUsers(Integer limit, Integer offset) {
        requireManager();
        int pageSize = limit == null ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return userProfileRepository.findAllByOrderByCreatedAtDesc(
                        new OffsetBasedPageRequest(offset == null ? 0 : offset, pageSize, Sort.unsorted()))
                .stream()
                .map(UserAdminServiceImpl::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserSummaryDto> getUsersByRole(UserRole role) {
        requireManager();
        Objects.requireNonNull(role, "role");
        return userProfileRepository.findAllByRoleOrderByCreatedAtDesc(role).stream()
                .map(UserAdminServiceImpl::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserSummaryDto> searchUsers(String query) {
        requireManager();
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query cannot be blank");
        }
        return userProfileRepository.search(query.trim(), new OffsetBasedPageRequest(0, SEARCH_LIMIT, Sort.unsorted()))
                .stream()
                .map(UserAdminServiceImpl::toDto)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public UserRoleCountsDto countByRole() {
        requireManager();
        long admins = userProfileRepository.countByRole(UserRole.ADMIN);
        long managers = userProfileRepository.countByRole(UserRole.CONTENT_MANAGER);
        long users = userProfileRepository.countByRole(UserRole.USER);
        return new UserRoleCountsDto(admins + managers + users, admins, managers, users);
    }

    @Override
    @Transactional
    public UserSummaryDto updateUserRole(UUID userId, UserRole role) {
        CurrentUser actor = requireManager();
        if (role == null) {
            throw new ValidationException("Role is required");
        }
        rejectSelfChange(actor, userId);

        UserProfile profile = userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User profile", userId));
        if (profile.getRole() == role) {
            return toDto(profile);
        }
        UserRole previous = profile.getRole();
        profile.setRole(role);
        UserProfile saved = userProfileRepository.save(profile);
        log.info("User {} changed role of {} from {} to {}", actor.id(), userId, previous, role);
        return toDto(saved);
    }

    @Override
    @Transactional
    public List<UserSummaryDto> batchUpdateUserRoles(List<RoleAssignment> assignments) {
        CurrentUser actor = requireManager();
        if (assignments == null || assignments.isEmpty()) {
            throw new ValidationException("At least one assignment is required");
        }

        Map<UUID, UserRole> requested = new LinkedHashMap<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment == null || assignment.userId() == null || assignment.role() == null) {
                throw new ValidationException("Each assignment needs a user id and a role");
            }
            rejectSelfChange(actor, assignment.userId());
            if (requested.put(assignment.userId(), assignment.role()) != null) {
                throw new ValidationException("User " + assignment.userId() + " appears more than once in the batch");
            }
        }

        Map<UUID, UserProfile> profiles = userProfileRepository.findAllByIdIn(requested.keySet()).stream()
                .collect(Collectors.toMap(UserProfile::getId, Function.identity()));
        List<UUID> missing = requested.keySet().stream()
                .filter(id -> !profiles.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new ResourceNotFoundException("User profiles not found: " + missing);
        }

        List<UserProfile> changed = new ArrayList<>();
        requested.forEach((id, role) -> {
            UserProfile profile = profiles.get(id);
            if (profile.getRole() != role) {
                profile.setRole(role);
                changed.add(profile);
            }
        });
        if (!changed.isEmpty()) {
            userProfileRepository.saveAll(changed);
        }
        log.info("User {} applied {} role assignments ({} changed)", actor.id(), requested.size(), changed.size());

        return requested.keySet().stream()
                .map(profiles::get)
                .map(UserAdminServiceImpl::toDto)
                .toList();
    }

    private CurrentUser requireManager() {
        CurrentUser actor = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(actor, PermissionName.USERS_MANAGE);
        return actor;
    }

    private void rejectSelfChange(CurrentUser actor, UUID userId) {
        if (accessPolicy.isSelf(actor, userId)) {
            throw new ValidationException("Administrators cannot change their own role");
        }
    }

    static UserSummaryDto toDto(UserProfile profile) {
        return new UserSummaryDto(
                profile.getId(),
                profile.getDisplayName(),
                profile.getBio(),
                profile.getRole(),
                profile.getLastActiveAt(),
                profile.getCreatedAt()
        );
    }
}
