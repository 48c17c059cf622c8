package uk.gegc.learnpath.features.content.domain.model;

public enum ContentStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
