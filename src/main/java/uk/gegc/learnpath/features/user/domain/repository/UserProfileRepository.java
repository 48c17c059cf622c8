package uk.gegc.learnpath.features.user.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.shared.security.UserRole;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    long countByLastActiveAtGreaterThanEqual(Instant since);

    long countByRole(UserRole role);

    List<UserProfile> findAllByIdIn(Collection<UUID> ids);

    List<UserProfile> findAllByRoleOrderByCreatedAtDesc(UserRole role);

    List<UserProfile> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("""
              SELECT u FROM UserProfile u
              WHERE LOWER(u.displayName) LIKE LOWER(CONCAT('%', :term, '%'))
                 OR LOWER(u.bio) LIKE LOWER(CONCAT('%', :term, '%'))
              ORDER BY u.createdAt DESC
            """)
    List<UserProfile> search(@Param("term") String term, Pageable pageable);
}
