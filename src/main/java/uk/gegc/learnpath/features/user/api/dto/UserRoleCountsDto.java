package uk.gegc.learnpath.features.user.api.dto;

public record UserRoleCountsDto(long total, long admins, long contentManagers, long users) {
}
