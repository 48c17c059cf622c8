package uk.gegc.learnpath.features.progress.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.progress.domain.model.UserXp;

import java.util.List;
import java.util.UUID;

@Repository
public interface UserXpRepository extends JpaRepository<UserXp, UUID> {

    List<UserXp> findAllByOrderByTotalXpDesc(Pageable pageable);

    @Query("""
              SELECT x.currentLevel AS level, COUNT(x) AS users
              FROM UserXp x
              GROUP BY x.currentLevel
              ORDER BY x.currentLevel
            """)
    List<LevelCount> countUsersPerLevel();

    interface LevelCount {
        int getLevel();

        long getUsers();
    }
}
