package uk.gegc.learnpath.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "lessons")
public class Lesson extends ContentNode {

    public static final int DEFAULT_XP_REWARD = 10;

    @Column(name = "module_id", nullable = false)
    private UUID moduleId;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "summary", length = 1000)
    private String summary;

    @Column(name = "estimated_minutes")
    private Integer estimatedMinutes;

    @Column(name = "xp_reward", nullable = false)
    private Integer xpReward = DEFAULT_XP_REWARD;

    @Enumerated(EnumType.STRING)
    @Column(name = "lesson_type", nullable = false, length = 20)
    private LessonType lessonType = LessonType.READING;

    @Column(name = "video_url", length = 500)
    private String videoUrl;

    @Override
    public ContentKind getKind() {
        return ContentKind.LESSON;
    }

    @Override
    public UUID getParentId() {
        return moduleId;
    }

    @Override
    public void setParentId(UUID parentId) {
        this.moduleId = parentId;
    }
}
