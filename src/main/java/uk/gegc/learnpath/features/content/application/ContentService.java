package uk.gegc.learnpath.features.content.application;

import uk.gegc.learnpath.features.content.api.dto.ContentListQuery;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeDto;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeRequest;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.List;
import java.util.UUID;

/**
 * Cached CRUD over the content tree. Callers without {@code content:update}
 * only ever see published nodes.
 */
public interface ContentService {

    ContentNodeDto get(ContentKind kind, UUID id);

    List<ContentNodeDto> list(ContentKind kind, ContentListQuery query);

    ContentNodeDto create(ContentKind kind, ContentNodeRequest request);

    /**
     * Partial update. Moving a node to draft or archived cascades the status to all descendants
     * before returning; moving it to published requires {@code content:publish} and a published parent.
     */
    ContentNodeDto update(ContentKind kind, UUID id, ContentNodeRequest request);
}
