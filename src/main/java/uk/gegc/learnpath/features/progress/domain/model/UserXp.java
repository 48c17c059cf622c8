package uk.gegc.learnpath.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Per-user XP aggregate; {@code totalXp} equals the sum of the user's progress XP.
 */
@Entity
@Getter
@Setter
@Table(name = "user_xp")
public class UserXp {

    @Id
    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID userId;

    @Column(name = "total_xp", nullable = false)
    private int totalXp;

    @Column(name = "current_level", nullable = false)
    private int currentLevel = 1;

    @Column(name = "level_title", length = 50)
    private String levelTitle;

    @Column(name = "current_streak", nullable = false)
    private int currentStreak;

    @Column(name = "longest_streak", nullable = false)
    private int longestStreak;

    @Column(name = "last_activity_date")
    private LocalDate lastActivityDate;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
