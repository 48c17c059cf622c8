package uk.gegc.learnpath.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Getter
@Setter
@Table(name = "xp_levels")
public class XpLevel {

    @Id
    @Column(name = "level_id", nullable = false)
    private Integer levelId;

    @Column(name = "title", nullable = false, length = 50)
    private String title;

    @Column(name = "xp_required", nullable = false)
    private int xpRequired;

    @Column(name = "badge_icon", length = 50)
    private String badgeIcon;

    @Column(name = "badge_color", length = 20)
    private String badgeColor;
}
