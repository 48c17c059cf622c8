package uk.gegc.learnpath.features.scoring.domain.model;

import uk.gegc.learnpath.shared.exception.ValidationException;

import java.util.Locale;

public enum QuestionType {
    SINGLE_CHOICE("single_choice"),
    MULTIPLE_CHOICE("multiple_choice"),
    OPEN_TEXT("open_text"),
    DRAG_DROP("drag_drop");

    private final String value;

    QuestionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static QuestionType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (QuestionType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new ValidationException("Unsupported question type: " + value);
    }
}
