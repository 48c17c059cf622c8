package uk.gegc.learnpath.features.content.api.dto;

import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.model.Difficulty;

import java.util.List;
import java.util.UUID;

public record ContentListQuery(
        UUID parentId,
        List<ContentStatus> statuses,
        Difficulty difficulty,
        String search,
        ContentSortField sort,
        boolean ascending,
        Integer limit,
        Integer offset
) {

    public ContentListQuery {
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        sort = sort == null ? ContentSortField.SORT_ORDER : sort;
    }

    public static ContentListQuery children(UUID parentId) {
        return new ContentListQuery(parentId, null, null, null, null, true, null, null);
    }
}
