package uk.gegc.learnpath.features.progress.domain.model;

public enum ProgressStatus {
    NOT_STARTED,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED
}
