package uk.gegc.learnpath.features.progress.api.dto;

public record XpLevelDto(int levelId, String title, int xpRequired, String badgeIcon, String badgeColor) {
}
