package uk.gegc.learnpath.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.shared.exception.ForbiddenException;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Applies role-permission and ownership rules in one place so feature services
 * stay focused on business logic.
 */
@Component
@Slf4j
public class AccessPolicy {

    public boolean isSelf(CurrentUser user, UUID userId) {
        return user != null && userId != null && userId.equals(user.id());
    }

    public boolean hasAny(CurrentUser user, PermissionName... permissions) {
        if (user == null || permissions == null || permissions.length == 0) {
            return false;
        }
        return Arrays.stream(permissions)
                .filter(Objects::nonNull)
                .anyMatch(user::has);
    }

    public void requireAny(CurrentUser user, PermissionName... permissions) {
        if (!hasAny(user, permissions)) {
            throwForbidden(user, "Required permission missing: " + Arrays.toString(permissions));
        }
    }

    public void requireSelfOrAny(CurrentUser user, UUID userId, PermissionName... permissions) {
        if (isSelf(user, userId) || hasAny(user, permissions)) {
            return;
        }
        throwForbidden(user, "Acting on behalf of another user requires elevated permission");
    }

    private void throwForbidden(CurrentUser user, String message) {
        log.debug("Access denied for user {}: {}", user != null ? user.id() : null, message);
        throw new ForbiddenException(message);
    }
}
