package uk.gegc.learnpath.features.scoring.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One question of a challenge definition, positioned by {@code index}.
 *
 * @param definition the raw question object, including type-specific fields such as options
 */
public record ChallengeQuestion(int index, QuestionType type, String prompt, String rubric, JsonNode definition) {
}
