package uk.gegc.learnpath.features.progress.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnpath.features.progress.domain.model.UserProgress;
import uk.gegc.learnpath.shared.query.QueryableRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserProgressRepository extends JpaRepository<UserProgress, UUID>, QueryableRepository<UserProgress> {

    Optional<UserProgress> findByUserIdAndContentIdAndContentKind(UUID userId, UUID contentId, ContentKind contentKind);

    List<UserProgress> findAllByUserIdOrderByLastAccessedAtDesc(UUID userId);

    List<UserProgress> findAllByUserIdAndContentId(UUID userId, UUID contentId);

    long countByUserIdAndContentKindAndStatusAndContentIdIn(UUID userId,
                                                            ContentKind contentKind,
                                                            ProgressStatus status,
                                                            Collection<UUID> contentIds);

    long countByUserIdAndContentKindAndStatus(UUID userId, ContentKind contentKind, ProgressStatus status);

    @Query("SELECT COALESCE(SUM(p.timeSpentMinutes), 0) FROM UserProgress p WHERE p.userId = :userId")
    long sumTimeSpentMinutes(@Param("userId") UUID userId);

    @Query("""
              SELECT p
              FROM UserProgress p
              WHERE p.status = uk.gegc.learnpath.features.progress.domain.model.ProgressStatus.COMPLETED
                AND p.completedAt IS NOT NULL
              ORDER BY p.completedAt DESC
            """)
    List<UserProgress> findRecentCompletions(Pageable pageable);

    /**
     * Distinct learners with lesson progress anywhere under each learning path.
     */
    @Query("""
              SELECT c.pathId AS pathId,
                     COUNT(DISTINCT p.userId) AS learners
              FROM UserProgress p, Lesson l, CourseModule m, Course c
              WHERE p.contentKind = uk.gegc.learnpath.features.content.domain.model.ContentKind.LESSON
                AND p.contentId = l.id
                AND l.moduleId = m.id
                AND m.courseId = c.id
              GROUP BY c.pathId
            """)
    List<PathLearnerCount> countLearnersPerPath();

    interface PathLearnerCount {
        UUID getPathId();

        long getLearners();
    }
}
