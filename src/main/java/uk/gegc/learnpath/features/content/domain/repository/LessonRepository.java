package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.Lesson;

@Repository
public interface LessonRepository extends ContentNodeRepository<Lesson> {
}
