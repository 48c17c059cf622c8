package uk.gegc.learnpath.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "challenges")
public class Challenge extends ContentNode {

    public static final int DEFAULT_XP_REWARD = 20;

    @Column(name = "lesson_id", nullable = false)
    private UUID lessonId;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 30)
    private ChallengeType challengeType = ChallengeType.QUIZ;

    /**
     * JSON document {@code {"questions":[...]}}.
     */
    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    /**
     * JSON document {@code {"answers":[...]}} aligned by question index.
     */
    @Column(name = "solution", columnDefinition = "TEXT")
    private String solution;

    /**
     * JSON array of hint strings.
     */
    @Column(name = "hints", columnDefinition = "TEXT")
    private String hints;

    @Column(name = "xp_reward", nullable = false)
    private Integer xpReward = DEFAULT_XP_REWARD;

    @Column(name = "max_attempts")
    private Integer maxAttempts;

    @Column(name = "time_limit_minutes")
    private Integer timeLimitMinutes;

    @Override
    public ContentKind getKind() {
        return ContentKind.CHALLENGE;
    }

    @Override
    public UUID getParentId() {
        return lessonId;
    }

    @Override
    public void setParentId(UUID parentId) {
        this.lessonId = parentId;
    }
}
