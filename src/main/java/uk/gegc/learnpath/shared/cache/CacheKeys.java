package uk.gegc.learnpath.shared.cache;

import java.util.UUID;

/**
 * Key builders shared by every feature that reads through {@link TtlCache}.
 * Invalidation is substring based, so keys embed the identifiers they depend on.
 */
public final class CacheKeys {

    public static final String STATS = "stats";
    public static final String CONTENT_STATS = "content_stats";
    public static final String XP_LEVELS = "xp_levels";
    public static final String CERTIFICATE_PREFIX = "certificate_";

    private CacheKeys() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String userProgress(UUID userId, UUID contentId) {
        return "user_progress_" + userId + "_" + (contentId == null ? "all" : contentId);
    }

    public static String userProgressPrefix(UUID userId) {
        return "user_progress_" + userId;
    }

    public static String userXp(UUID userId) {
        return "user_xp_" + userId;
    }

    public static String userStats(UUID userId) {
        return "user_stats_" + userId;
    }

    public static String userCertificates(UUID userId) {
        return "user_certificates_" + userId;
    }

    public static String certificate(String verificationCode) {
        return CERTIFICATE_PREFIX + verificationCode;
    }
}
