package uk.gegc.learnpath.features.content.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "modules")
public class CourseModule extends ContentNode {

    @Column(name = "course_id", nullable = false)
    private UUID courseId;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "short_description", length = 500)
    private String shortDescription;

    @Column(name = "estimated_minutes")
    private Integer estimatedMinutes;

    @Override
    public ContentKind getKind() {
        return ContentKind.MODULE;
    }

    @Override
    public UUID getParentId() {
        return courseId;
    }

    @Override
    public void setParentId(UUID parentId) {
        this.courseId = parentId;
    }
}
