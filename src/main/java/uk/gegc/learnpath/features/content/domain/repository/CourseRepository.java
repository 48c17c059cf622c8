package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.Course;

@Repository
public interface CourseRepository extends ContentNodeRepository<Course> {
}
