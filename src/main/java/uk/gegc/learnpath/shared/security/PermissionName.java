package uk.gegc.learnpath.shared.security;

public enum PermissionName {
    // Content Permissions
    CONTENT_CREATE("content", "create", "Create learning content"),
    CONTENT_UPDATE("content", "update", "Update learning content"),
    CONTENT_PUBLISH("content", "publish", "Publish content"),

    // Certificate Permissions
    CERTIFICATES_ISSUE("certificates", "issue", "Issue certificates on behalf of other users"),
    CERTIFICATES_REVOKE("certificates", "revoke", "Revoke issued certificates"),

    // Analytics Permissions
    ANALYTICS_READ("analytics", "read", "View platform analytics"),

    // Progress Permissions
    PROGRESS_READ("progress", "read", "View own progress"),
    PROGRESS_UPDATE("progress", "update", "Record own progress"),

    // User Permissions
    USERS_MANAGE("users", "manage", "List users and change their roles"),

    // System Permissions
    CACHE_MANAGE("cache", "manage", "Inspect and clear the content cache");

    private final String resource;
    private final String action;
    private final String description;

    PermissionName(String resource, String action, String description) {
        this.resource = resource;
        this.action = action;
        this.description = description;
    }

    public String getResource() {
        return resource;
    }

    public String getAction() {
        return action;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Authority string in {@code resource:action} form, as used by {@code @PreAuthorize}.
     */
    public String getAuthority() {
        return resource + ":" + action;
    }
}
