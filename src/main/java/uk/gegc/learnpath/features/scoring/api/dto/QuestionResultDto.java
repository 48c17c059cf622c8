package uk.gegc.learnpath.features.scoring.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionResultDto(int index, QuestionType type, boolean correct, Integer aiScore, boolean degraded) {
}
