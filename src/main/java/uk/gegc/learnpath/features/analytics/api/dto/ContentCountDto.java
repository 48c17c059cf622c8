package uk.gegc.learnpath.features.analytics.api.dto;

public record ContentCountDto(long total, long published) {

    public static final ContentCountDto EMPTY = new ContentCountDto(0, 0);
}
