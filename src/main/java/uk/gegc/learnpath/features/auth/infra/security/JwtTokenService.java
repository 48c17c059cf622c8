package uk.gegc.learnpath.features.auth.infra.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.PermissionName;
import uk.gegc.learnpath.shared.security.UserRole;

import javax.crypto.SecretKey;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Verifies bearer tokens minted by the external identity provider.
 * The {@code sub} claim carries the user id, {@code user_role} the role.
 */
@Component
@Slf4j
public class JwtTokenService {

    static final String ROLE_CLAIM = "user_role";

    @Value("${learnpath.security.jwt-secret}")
    private String base64secret;

    private SecretKey key;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(base64secret);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public Authentication getAuthentication(String token) {
        Claims claims = parse(token);
        CurrentUser user = new CurrentUser(
                UUID.fromString(claims.getSubject()),
                UserRole.fromClaim(claims.get(ROLE_CLAIM, String.class))
        );
        return new UsernamePasswordAuthenticationToken(user, null, authoritiesOf(user.role()));
    }

    public boolean validateToken(String token) {
        try {
            Claims claims = parse(token);
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("JWT token missing subject");
                return false;
            }
            UUID.fromString(subject);
            return true;
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
            return false;
        } catch (MalformedJwtException ex) {
            log.warn("Malformed JWT token received: {}", ex.getMessage());
            return false;
        } catch (SignatureException ex) {
            log.warn("Invalid JWT signature detected: {}", ex.getMessage());
            return false;
        } catch (IllegalArgumentException ex) {
            log.warn("JWT subject is not a user id or token is empty: {}", ex.getMessage());
            return false;
        } catch (JwtException ex) {
            log.error("Unexpected JWT exception: {}", ex.getMessage());
            return false;
        }
    }

    private Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    static List<GrantedAuthority> authoritiesOf(UserRole role) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + role.name()));
        for (PermissionName permission : role.getPermissions()) {
            authorities.add(new SimpleGrantedAuthority(permission.getAuthority()));
        }
        return authorities;
    }
}
