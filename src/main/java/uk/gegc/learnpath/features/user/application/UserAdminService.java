package uk.gegc.learnpath.features.user.application;

import uk.gegc.learnpath.features.user.api.dto.RoleAssignment;
import uk.gegc.learnpath.features.user.api.dto.UserRoleCountsDto;
import uk.gegc.learnpath.features.user.api.dto.UserSummaryDto;
import uk.gegc.learnpath.shared.security.UserRole;

import java.util.List;
import java.util.UUID;

/**
 * Role administration over user profiles. Every operation requires the users-manage permission.
 */
public interface UserAdminService {

    /**
     * Newest profiles first.
     */
    List<UserSummaryDto> listUsers(Integer limit, Integer offset);

    List<UserSummaryDto> getUsersByRole(UserRole role);

    /**
     * Case-insensitive match on display name or bio, newest first.
     */
    List<UserSummaryDto> searchUsers(String query);

    UserRoleCountsDto countByRole();

    UserSummaryDto updateUserRole(UUID userId, UserRole role);

    /**
     * Applies every assignment or none. Unknown ids and duplicate ids reject the whole batch.
     */
    List<UserSummaryDto> batchUpdateUserRoles(List<RoleAssignment> assignments);
}
