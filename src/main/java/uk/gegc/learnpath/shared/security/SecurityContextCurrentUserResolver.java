package uk.gegc.learnpath.shared.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.shared.exception.UnauthorizedException;

import java.util.Optional;

@Component
public class SecurityContextCurrentUserResolver implements CurrentUserResolver {

    @Override
    public Optional<CurrentUser> findCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof CurrentUser currentUser) {
            return Optional.of(currentUser);
        }
        return Optional.empty();
    }

    @Override
    public CurrentUser requireCurrentUser() {
        return findCurrentUser()
                .orElseThrow(() -> new UnauthorizedException("Authentication is required"));
    }
}
