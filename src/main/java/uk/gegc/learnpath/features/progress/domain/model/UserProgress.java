package uk.gegc.learnpath.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "user_progress",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_progress_item",
                columnNames = {"user_id", "content_id", "content_kind"}))
public class UserProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "content_id", nullable = false, updatable = false)
    private UUID contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_kind", nullable = false, updatable = false, length = 20)
    private ContentKind contentKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ProgressStatus status = ProgressStatus.NOT_STARTED;

    @Column(name = "completion_percentage", nullable = false)
    private int completionPercentage;

    @Column(name = "xp_earned", nullable = false)
    private int xpEarned;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "score")
    private Integer score;

    @Column(name = "time_spent_minutes", nullable = false)
    private int timeSpentMinutes;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
