package uk.gegc.learnpath.features.content.domain.repository;

import org.springframework.stereotype.Repository;
import uk.gegc.learnpath.features.content.domain.model.CourseModule;

@Repository
public interface CourseModuleRepository extends ContentNodeRepository<CourseModule> {
}
