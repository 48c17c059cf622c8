package uk.gegc.learnpath.features.content.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.learnpath.features.content.application.CascadeResult;
import uk.gegc.learnpath.features.content.application.StatusCascadeService;
import uk.gegc.learnpath.features.content.domain.exception.CascadeFailedException;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.repository.ContentNodeRepository;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.query.QuerySpec;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatusCascadeServiceImpl implements StatusCascadeService {

    private final ContentNodeRegistry registry;
    private final TransactionTemplate transactionTemplate;

    @Override
    public CascadeResult cascade(UUID nodeId, ContentKind nodeKind, ContentStatus targetStatus, UUID actorId) {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(nodeKind, "nodeKind");
        if (targetStatus != ContentStatus.DRAFT && targetStatus != ContentStatus.ARCHIVED) {
            throw new ValidationException("Cascade target must be DRAFT or ARCHIVED, got " + targetStatus);
        }

        Map<ContentKind, Integer> visited = new EnumMap<>(ContentKind.class);
        Map<ContentKind, List<UUID>> updated = new EnumMap<>(ContentKind.class);
        List<UUID> parentIds = List.of(nodeId);

        for (ContentKind level : nodeKind.descendants()) {
            if (parentIds.isEmpty()) {
                break;
            }
            LevelOutcome outcome = runLevel(level, parentIds, targetStatus, actorId,
                    new CascadeResult(nodeId, nodeKind, targetStatus, visited, updated));
            visited.put(level, outcome.childIds().size());
            if (!outcome.updatedIds().isEmpty()) {
                updated.put(level, outcome.updatedIds());
            }
            parentIds = outcome.childIds();
        }

        CascadeResult result = new CascadeResult(nodeId, nodeKind, targetStatus, visited, updated);
        log.info("Cascade {} {} -> {}: visited {}, updated {} ({})",
                nodeKind.getKey(), nodeId, targetStatus, result.totalVisited(), result.totalUpdated(), visited);
        return result;
    }

    private LevelOutcome runLevel(ContentKind level,
                                  List<UUID> parentIds,
                                  ContentStatus targetStatus,
                                  UUID actorId,
                                  CascadeResult soFar) {
        try {
            LevelOutcome outcome = transactionTemplate.execute(tx -> cascadeLevel(level, parentIds, targetStatus, actorId));
            return outcome != null ? outcome : new LevelOutcome(List.of(), List.of());
        } catch (DataAccessException | TransactionException ex) {
            log.error("Cascade to {} failed at level '{}' after updating {}", targetStatus, level.getKey(), soFar.updated(), ex);
            throw new CascadeFailedException(level, soFar, ex);
        }
    }

    private LevelOutcome cascadeLevel(ContentKind level, List<UUID> parentIds, ContentStatus targetStatus, UUID actorId) {
        ContentNodeRepository<ContentNode> repository = registry.repository(level);
        List<ContentNode> children = repository.select(QuerySpec.builder()
                .in(level.getParentAttribute(), parentIds)
                .build());

        List<UUID> childIds = new ArrayList<>(children.size());
        List<ContentNode> changed = new ArrayList<>();
        for (ContentNode child : children) {
            childIds.add(child.getId());
            if (child.getStatus() != targetStatus) {
                child.setStatus(targetStatus);
                if (actorId != null) {
                    child.setUpdatedBy(actorId);
                }
                changed.add(child);
            }
        }
        if (!changed.isEmpty()) {
            repository.saveAll(changed);
        }
        return new LevelOutcome(childIds, changed.stream().map(ContentNode::getId).toList());
    }

    private record LevelOutcome(List<UUID> childIds, List<UUID> updatedIds) {
    }
}
