package uk.gegc.learnpath.features.user.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.learnpath.shared.security.UserRole;

import java.time.Instant;
import java.util.UUID;

/**
 * Profile row written by the identity provider's sign-up hook. Only the role is changed here, by administrators;
 * the identity provider copies it into the token claims on the next sign-in.
 */
@Entity
@Getter
@Setter
@Table(name = "user_profiles")
public class UserProfile {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "display_name", length = 100)
    private String displayName;

    @Column(name = "bio", length = 1000)
    private String bio;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 30)
    private UserRole role = UserRole.USER;

    @Column(name = "last_active_at")
    private Instant lastActiveAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
