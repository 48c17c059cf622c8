package uk.gegc.learnpath.features.ai.api.dto;

public record AudienceDto(String key, String label) {
}
