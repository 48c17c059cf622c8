package uk.gegc.learnpath.features.content.api.dto;

public enum ContentSortField {
    CREATED_AT("createdAt"),
    UPDATED_AT("updatedAt"),
    TITLE("title"),
    SORT_ORDER("sortOrder");

    private final String attribute;

    ContentSortField(String attribute) {
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
