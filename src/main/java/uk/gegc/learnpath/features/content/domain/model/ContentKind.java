package uk.gegc.learnpath.features.content.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The five levels of the content tree, declared root first.
 * Declaration order is the hierarchy order used by cascading and completion checks.
 */
public enum ContentKind {
    PATH("path", "learning_paths", "learning_path", null),
    COURSE("course", "courses", "course", "pathId"),
    MODULE("module", "modules", "module", "courseId"),
    LESSON("lesson", "lessons", "lesson", "moduleId"),
    CHALLENGE("challenge", "challenges", "challenge", "lessonId");

    private final String key;
    private final String collectionCacheKey;
    private final String itemCacheKey;
    private final String parentAttribute;

    ContentKind(String key, String collectionCacheKey, String itemCacheKey, String parentAttribute) {
        this.key = key;
        this.collectionCacheKey = collectionCacheKey;
        this.itemCacheKey = itemCacheKey;
        this.parentAttribute = parentAttribute;
    }

    public String getKey() {
        return key;
    }

    public String getCollectionCacheKey() {
        return collectionCacheKey;
    }

    public String getItemCacheKey() {
        return itemCacheKey;
    }

    /**
     * Entity attribute holding the parent id, {@code null} for {@link #PATH}.
     */
    public String getParentAttribute() {
        return parentAttribute;
    }

    public boolean isRoot() {
        return this == PATH;
    }

    public ContentKind parent() {
        return isRoot() ? null : values()[ordinal() - 1];
    }

    public ContentKind child() {
        return this == CHALLENGE ? null : values()[ordinal() + 1];
    }

    /**
     * Every level strictly below this one, nearest first.
     */
    public List<ContentKind> descendants() {
        ContentKind[] all = values();
        return Arrays.asList(all).subList(ordinal() + 1, all.length);
    }

    public boolean isCertifiable() {
        return this == PATH || this == COURSE;
    }

    /**
     * Resolves a URL or payload token such as {@code course}, {@code courses} or {@code learning_paths}.
     */
    public static ContentKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Content kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ContentKind kind : values()) {
            if (kind.key.equals(normalized)
                    || kind.collectionCacheKey.equals(normalized)
                    || (kind.key + "s").equals(normalized)
                    || kind.itemCacheKey.equals(normalized)
                    || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown content kind: " + value);
    }
}
