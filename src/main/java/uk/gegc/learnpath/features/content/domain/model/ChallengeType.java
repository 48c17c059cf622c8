package uk.gegc.learnpath.features.content.domain.model;

public enum ChallengeType {
    QUIZ,
    CODE,
    ESSAY,
    MULTIPLE_CHOICE
}
