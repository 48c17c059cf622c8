package uk.gegc.learnpath.features.analytics.api.dto;

import java.util.UUID;

/**
 * @param learners  users with progress on at least one lesson of the path
 * @param completed users holding an active certificate for the path
 */
public record PathEnrollmentDto(UUID pathId, String title, long learners, long completed) {
}
