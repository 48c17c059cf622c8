package uk.gegc.learnpath.features.analytics.api.dto;

public record LevelDistributionDto(int level, long users) {
}
