package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.LearningPath;

@Repository
public interface LearningPathRepository extends ContentNodeRepository<LearningPath> {
}
