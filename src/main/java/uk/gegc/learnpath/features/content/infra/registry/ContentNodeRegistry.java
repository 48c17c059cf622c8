package uk.gegc.learnpath.features.content.infra.registry;

import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.content.domain.model.*;
import uk.gegc.learnpath.features.content.domain.repository.*;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the repository and entity type backing each {@link ContentKind}.
 */
@Component
public class ContentNodeRegistry {

    private final Map<ContentKind, ContentNodeRepository<? extends ContentNode>> repositories;

    public ContentNodeRegistry(LearningPathRepository learningPathRepository,
                               CourseRepository courseRepository,
                               CourseModuleRepository courseModuleRepository,
                               LessonRepository lessonRepository,
                               ChallengeRepository challengeRepository) {
        this.repositories = new EnumMap<>(ContentKind.class);
        this.repositories.put(ContentKind.PATH, learningPathRepository);
        this.repositories.put(ContentKind.COURSE, courseRepository);
        this.repositories.put(ContentKind.MODULE, courseModuleRepository);
        this.repositories.put(ContentKind.LESSON, lessonRepository);
        this.repositories.put(ContentKind.CHALLENGE, challengeRepository);
    }

    @SuppressWarnings("unchecked")
    public ContentNodeRepository<ContentNode> repository(ContentKind kind) {
        ContentNodeRepository<? extends ContentNode> repository = repositories.get(kind);
        if (repository == null) {
            throw new IllegalArgumentException("No repository registered for " + kind);
        }
        return (ContentNodeRepository<ContentNode>) repository;
    }

    public Optional<ContentNode> find(ContentKind kind, UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository(kind).findById(id);
    }

    public ContentNode instantiate(ContentKind kind) {
        return switch (kind) {
            case PATH -> new LearningPath();
            case COURSE -> new Course();
            case MODULE -> new CourseModule();
            case LESSON -> new Lesson();
            case CHALLENGE -> new Challenge();
        };
    }
}
