package uk.gegc.learnpath.features.content.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeDto;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeRequest;
import uk.gegc.learnpath.features.content.domain.model.*;
import uk.gegc.learnpath.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static uk.gegc.learnpath.features.content.domain.model.ContentKind.*;

@Component
@RequiredArgsConstructor
public class ContentNodeMapper {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ContentNodeDto toDto(ContentNode node) {
        String description = null;
        String shortDescription = null;
        Difficulty difficulty = null;
        Integer estimatedHours = null;
        Integer estimatedMinutes = null;
        Boolean featured = null;
        String content = null;
        String summary = null;
        Integer xpReward = null;
        LessonType lessonType = null;
        String videoUrl = null;
        ChallengeType challengeType = null;
        JsonNode questions = null;
        List<String> hints = null;
        Integer maxAttempts = null;
        Integer timeLimitMinutes = null;

        if (node instanceof LearningPath path) {
            description = path.getDescription();
            shortDescription = path.getShortDescription();
            difficulty = path.getDifficulty();
            estimatedHours = path.getEstimatedHours();
            featured = path.isFeatured();
        } else if (node instanceof Course course) {
            description = course.getDescription();
            shortDescription = course.getShortDescription();
            difficulty = course.getDifficulty();
            estimatedHours = course.getEstimatedHours();
        } else if (node instanceof CourseModule module) {
            description = module.getDescription();
            shortDescription = module.getShortDescription();
            estimatedMinutes = module.getEstimatedMinutes();
        } else if (node instanceof Lesson lesson) {
            content = lesson.getContent();
            summary = lesson.getSummary();
            estimatedMinutes = lesson.getEstimatedMinutes();
            xpReward = lesson.getXpReward();
            lessonType = lesson.getLessonType();
            videoUrl = lesson.getVideoUrl();
        } else if (node instanceof Challenge challenge) {
            description = challenge.getDescription();
            challengeType = challenge.getChallengeType();
            questions = readTree(challenge.getContent());
            hints = readHints(challenge.getHints());
            xpReward = challenge.getXpReward();
            maxAttempts = challenge.getMaxAttempts();
            timeLimitMinutes = challenge.getTimeLimitMinutes();
        }

        return new ContentNodeDto(
                node.getKind(),
                node.getId(),
                node.getParentId(),
                node.getTitle(),
                node.getSlug(),
                node.getStatus(),
                node.getSortOrder(),
                description,
                shortDescription,
                difficulty,
                estimatedHours,
                estimatedMinutes,
                featured,
                content,
                summary,
                xpReward,
                lessonType,
                videoUrl,
                challengeType,
                questions,
                hints,
                maxAttempts,
                timeLimitMinutes,
                node.getCreatedBy(),
                node.getUpdatedBy(),
                node.getPublishedBy(),
                node.getPublishedAt(),
                node.getCreatedAt(),
                node.getUpdatedAt()
        );
    }

    /**
     * Copies every non-null attribute of {@code request} except status and parent onto {@code node}.
     *
     * @return whether any attribute changed
     */
    public boolean apply(ContentNode node, ContentNodeRequest request) {
        rejectInapplicable(node.getKind(), request);

        boolean changed = change(request.title(), node::getTitle, node::setTitle);
        changed |= change(request.slug(), node::getSlug, node::setSlug);
        changed |= change(request.sortOrder(), node::getSortOrder, node::setSortOrder);

        if (node instanceof LearningPath path) {
            changed |= change(request.description(), path::getDescription, path::setDescription);
            changed |= change(request.shortDescription(), path::getShortDescription, path::setShortDescription);
            changed |= change(request.difficulty(), path::getDifficulty, path::setDifficulty);
            changed |= change(request.estimatedHours(), path::getEstimatedHours, path::setEstimatedHours);
            changed |= change(request.featured(), path::isFeatured, path::setFeatured);
        } else if (node instanceof Course course) {
            changed |= change(request.description(), course::getDescription, course::setDescription);
            changed |= change(request.shortDescription(), course::getShortDescription, course::setShortDescription);
            changed |= change(request.difficulty(), course::getDifficulty, course::setDifficulty);
            changed |= change(request.estimatedHours(), course::getEstimatedHours, course::setEstimatedHours);
        } else if (node instanceof CourseModule module) {
            changed |= change(request.description(), module::getDescription, module::setDescription);
            changed |= change(request.shortDescription(), module::getShortDescription, module::setShortDescription);
            changed |= change(request.estimatedMinutes(), module::getEstimatedMinutes, module::setEstimatedMinutes);
        } else if (node instanceof Lesson lesson) {
            changed |= change(request.content(), lesson::getContent, lesson::setContent);
            changed |= change(request.summary(), lesson::getSummary, lesson::setSummary);
            changed |= change(request.estimatedMinutes(), lesson::getEstimatedMinutes, lesson::setEstimatedMinutes);
            changed |= change(request.xpReward(), lesson::getXpReward, lesson::setXpReward);
            changed |= change(request.lessonType(), lesson::getLessonType, lesson::setLessonType);
            changed |= change(request.videoUrl(), lesson::getVideoUrl, lesson::setVideoUrl);
        } else if (node instanceof Challenge challenge) {
            changed |= change(request.description(), challenge::getDescription, challenge::setDescription);
            changed |= change(request.challengeType(), challenge::getChallengeType, challenge::setChallengeType);
            changed |= change(questionsJson(request.questions()), challenge::getContent, challenge::setContent);
            changed |= change(solutionJson(request.solution()), challenge::getSolution, challenge::setSolution);
            changed |= change(request.hints() == null ? null : writeJson(request.hints()), challenge::getHints, challenge::setHints);
            changed |= change(request.xpReward(), challenge::getXpReward, challenge::setXpReward);
            changed |= change(request.maxAttempts(), challenge::getMaxAttempts, challenge::setMaxAttempts);
            changed |= change(request.timeLimitMinutes(), challenge::getTimeLimitMinutes, challenge::setTimeLimitMinutes);
        }
        return changed;
    }

    private void rejectInapplicable(ContentKind kind, ContentNodeRequest request) {
        List<String> rejected = new ArrayList<>();
        check(rejected, kind, "description", request.description(), EnumSet.of(PATH, COURSE, MODULE, CHALLENGE));
        check(rejected, kind, "shortDescription", request.shortDescription(), EnumSet.of(PATH, COURSE, MODULE));
        check(rejected, kind, "difficulty", request.difficulty(), EnumSet.of(PATH, COURSE));
        check(rejected, kind, "estimatedHours", request.estimatedHours(), EnumSet.of(PATH, COURSE));
        check(rejected, kind, "featured", request.featured(), EnumSet.of(PATH));
        check(rejected, kind, "estimatedMinutes", request.estimatedMinutes(), EnumSet.of(MODULE, LESSON));
        check(rejected, kind, "content", request.content(), EnumSet.of(LESSON));
        check(rejected, kind, "summary", request.summary(), EnumSet.of(LESSON));
        check(rejected, kind, "lessonType", request.lessonType(), EnumSet.of(LESSON));
        check(rejected, kind, "videoUrl", request.videoUrl(), EnumSet.of(LESSON));
        check(rejected, kind, "xpReward", request.xpReward(), EnumSet.of(LESSON, CHALLENGE));
        check(rejected, kind, "challengeType", request.challengeType(), EnumSet.of(CHALLENGE));
        check(rejected, kind, "questions", request.questions(), EnumSet.of(CHALLENGE));
        check(rejected, kind, "solution", request.solution(), EnumSet.of(CHALLENGE));
        check(rejected, kind, "hints", request.hints(), EnumSet.of(CHALLENGE));
        check(rejected, kind, "maxAttempts", request.maxAttempts(), EnumSet.of(CHALLENGE));
        check(rejected, kind, "timeLimitMinutes", request.timeLimitMinutes(), EnumSet.of(CHALLENGE));
        if (!rejected.isEmpty()) {
            throw new ValidationException("Fields not applicable to " + kind.getKey() + ": " + String.join(", ", rejected));
        }
    }

    private static void check(List<String> rejected, ContentKind kind, String field, Object value, Set<ContentKind> allowed) {
        if (value != null && !allowed.contains(kind)) {
            rejected.add(field);
        }
    }

    private static <V> boolean change(V value, Supplier<V> current, Consumer<V> setter) {
        if (value == null || Objects.equals(value, current.get())) {
            return false;
        }
        setter.accept(value);
        return true;
    }

    private String questionsJson(JsonNode questions) {
        if (questions == null) {
            return null;
        }
        if (!questions.isObject() || !questions.path("questions").isArray()) {
            throw new ValidationException("Challenge content must be an object with a 'questions' array");
        }
        for (JsonNode question : questions.get("questions")) {
            if (!question.hasNonNull("type")) {
                throw new ValidationException("Every challenge question requires a 'type'");
            }
        }
        return writeJson(questions);
    }

    private String solutionJson(JsonNode solution) {
        if (solution == null) {
            return null;
        }
        if (!solution.isObject() || !solution.path("answers").isArray()) {
            throw new ValidationException("Challenge solution must be an object with an 'answers' array");
        }
        return writeJson(solution);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Value cannot be serialized as JSON: " + e.getOriginalMessage());
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored challenge content is not valid JSON", e);
        }
    }

    private List<String> readHints(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored challenge hints are not valid JSON", e);
        }
    }
}
