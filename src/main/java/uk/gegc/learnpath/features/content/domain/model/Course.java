package uk.gegc.learnpath.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "courses")
public class Course extends ContentNode {

    @Column(name = "path_id", nullable = false)
    private UUID pathId;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "short_description", length = 500)
    private String shortDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", length = 20)
    private Difficulty difficulty;

    @Column(name = "estimated_hours")
    private Integer estimatedHours;

    @Override
    public ContentKind getKind() {
        return ContentKind.COURSE;
    }

    @Override
    public UUID getParentId() {
        return pathId;
    }

    @Override
    public void setParentId(UUID parentId) {
        this.pathId = parentId;
    }
}
