package uk.gegc.learnpath.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "learning_paths")
public class LearningPath extends ContentNode {

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "short_description", length = 500)
    private String shortDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", length = 20)
    private Difficulty difficulty;

    @Column(name = "estimated_hours")
    private Integer estimatedHours;

    @Column(name = "featured", nullable = false)
    private boolean featured;

    @Override
    public ContentKind getKind() {
        return ContentKind.PATH;
    }

    @Override
    public UUID getParentId() {
        return null;
    }

    @Override
    public void setParentId(UUID parentId) {
        if (parentId != null) {
            throw new IllegalArgumentException("Learning paths have no parent");
        }
    }
}
