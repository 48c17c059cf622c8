package uk.gegc.learnpath.features.content.domain.model;

public enum Difficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
