package uk.gegc.learnpath.shared.security;

import java.util.Optional;

public interface CurrentUserResolver {

    Optional<CurrentUser> findCurrentUser();

    /**
     * @throws uk.gegc.learnpath.shared.exception.UnauthorizedException when no user is authenticated
     */
    CurrentUser requireCurrentUser();
}
