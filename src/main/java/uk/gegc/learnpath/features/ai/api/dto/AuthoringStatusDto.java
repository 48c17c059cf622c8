package uk.gegc.learnpath.features.ai.api.dto;

import java.util.List;

public record AuthoringStatusDto(boolean available, List<AudienceDto> audiences) {
}
