package uk.gegc.learnpath.features.content.domain.model;

public enum LessonType {
    READING,
    VIDEO,
    INTERACTIVE,
    QUIZ
}
