package uk.gegc.learnpath.features.content.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.content.api.dto.ContentListQuery;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeDto;
import uk.gegc.learnpath.features.content.api.dto.ContentNodeRequest;
import uk.gegc.learnpath.features.content.application.CascadeResult;
import uk.gegc.learnpath.features.content.application.ContentService;
import uk.gegc.learnpath.features.content.application.StatusCascadeService;
import uk.gegc.learnpath.features.content.domain.exception.CascadeFailedException;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.repository.ContentNodeRepository;
import uk.gegc.learnpath.features.content.infra.mapping.ContentNodeMapper;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.shared.cache.CacheKeys;
import uk.gegc.learnpath.shared.cache.CacheProperties;
import uk.gegc.learnpath.shared.cache.TtlCache;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.query.QuerySpec;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.PermissionName;
import uk.gegc.learnpath.shared.util.SlugUtils;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
@Slf4j
public class ContentServiceImpl implements ContentService {

    private final ContentNodeRegistry registry;
    private final ContentNodeMapper mapper;
    private final StatusCascadeService cascadeService;
    private final TtlCache cache;
    private final CacheProperties cacheProperties;
    private final CurrentUserResolver currentUserResolver;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    public ContentNodeDto get(ContentKind kind, UUID id) {
        ContentNodeDto dto = readThrough(kind.getItemCacheKey() + "_" + id, () -> registry.find(kind, id)
                .map(mapper::toDto)
                .orElseThrow(() -> notFound(kind, id)));
        if (dto.status() != ContentStatus.PUBLISHED && !canSeeUnpublished()) {
            throw notFound(kind, id);
        }
        return dto;
    }

    @Override
    public List<ContentNodeDto> list(ContentKind kind, ContentListQuery query) {
        ContentListQuery q = query != null ? query : ContentListQuery.children(null);
        if (kind.isRoot() && q.parentId() != null) {
            throw new ValidationException("Learning paths have no parent");
        }
        if (q.difficulty() != null && kind != ContentKind.PATH && kind != ContentKind.COURSE) {
            throw new ValidationException("Difficulty filter applies to paths and courses only");
        }

        List<ContentStatus> statuses = q.statuses();
        if (!canSeeUnpublished()) {
            if (!statuses.isEmpty() && !statuses.contains(ContentStatus.PUBLISHED)) {
                return List.of();
            }
            statuses = List.of(ContentStatus.PUBLISHED);
        }

        QuerySpec.Builder spec = QuerySpec.builder();
        if (q.parentId() != null) {
            spec.eq(kind.getParentAttribute(), q.parentId());
        }
        if (!statuses.isEmpty()) {
            spec.in("status", statuses);
        }
        if (q.difficulty() != null) {
            spec.eq("difficulty", q.difficulty());
        }
        if (q.search() != null && !q.search().isBlank()) {
            spec.like("title", q.search().trim());
        }
        spec.orderBy(q.sort().getAttribute(), q.ascending());
        if (!"createdAt".equals(q.sort().getAttribute())) {
            spec.orderBy("createdAt", true);
        }
        spec.limit(q.limit());
        spec.offset(q.offset() != null ? q.offset() : 0);
        QuerySpec built = spec.build();

        String key = kind.getCollectionCacheKey() + "_" + (q.parentId() != null ? q.parentId() : "all") + "_" + built.cacheKey();
        return readThrough(key, () -> registry.repository(kind).select(built).stream()
                .map(mapper::toDto)
                .toList());
    }

    @Override
    public ContentNodeDto create(ContentKind kind, ContentNodeRequest request) {
        CurrentUser user = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(user, PermissionName.CONTENT_CREATE);

        if (request.title() == null || request.title().isBlank()) {
            throw new ValidationException("Title is required");
        }
        UUID parentId = request.parentId();
        if (kind.isRoot()) {
            if (parentId != null) {
                throw new ValidationException("Learning paths have no parent");
            }
        } else {
            if (parentId == null) {
                throw new ValidationException("A " + kind.getKey() + " requires a parent " + kind.parent().getKey());
            }
            registry.find(kind.parent(), parentId).orElseThrow(() -> notFound(kind.parent(), parentId));
        }

        String slug = request.slug() != null ? request.slug() : SlugUtils.slugify(request.title());
        if (slug.isBlank()) {
            throw new ValidationException("A slug cannot be derived from the title; provide one explicitly");
        }
        ensureSlugAvailable(kind, parentId, slug, null);
        if (request.sortOrder() != null) {
            ensureSortOrderAvailable(kind, parentId, request.sortOrder(), null);
        }

        ContentNode node = registry.instantiate(kind);
        node.setParentId(parentId);
        mapper.apply(node, request);
        node.setSlug(slug);
        node.setStatus(ContentStatus.DRAFT);
        if (request.sortOrder() == null) {
            node.setSortOrder(nextSortOrder(kind, parentId));
        }
        node.setCreatedBy(user.id());
        node.setUpdatedBy(user.id());

        ContentNode saved = registry.repository(kind).save(node);
        cache.invalidate(kind.getCollectionCacheKey());
        cache.invalidate(CacheKeys.STATS);
        log.info("User {} created {} {} '{}'", user.id(), kind.getKey(), saved.getId(), saved.getTitle());
        return mapper.toDto(saved);
    }

    @Override
    public ContentNodeDto update(ContentKind kind, UUID id, ContentNodeRequest request) {
        CurrentUser user = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(user, PermissionName.CONTENT_UPDATE);

        ContentNodeRepository<ContentNode> repository = registry.repository(kind);
        ContentNode node = repository.findById(id).orElseThrow(() -> notFound(kind, id));

        if (request.parentId() != null && !request.parentId().equals(node.getParentId())) {
            throw new ValidationException("Moving content to another parent is not supported");
        }

        ContentStatus previous = node.getStatus();
        ContentStatus target = request.status();
        boolean statusChange = target != null && target != previous;
        if (statusChange && target == ContentStatus.PUBLISHED) {
            accessPolicy.requireAny(user, PermissionName.CONTENT_PUBLISH);
            ensureParentPublished(node);
        }

        if (request.slug() != null && !request.slug().equals(node.getSlug())) {
            ensureSlugAvailable(kind, node.getParentId(), request.slug(), id);
        }
        if (request.sortOrder() != null && !request.sortOrder().equals(node.getSortOrder())) {
            ensureSortOrderAvailable(kind, node.getParentId(), request.sortOrder(), id);
        }

        boolean attributesChanged = mapper.apply(node, request);
        if (!attributesChanged && !statusChange) {
            return mapper.toDto(node);
        }

        if (statusChange) {
            node.setStatus(target);
            if (target == ContentStatus.PUBLISHED) {
                node.setPublishedBy(user.id());
                node.setPublishedAt(clock.instant());
            }
        }
        node.setUpdatedBy(user.id());

        CascadeResult cascade = null;
        ContentKind failedLevel = null;
        ContentNode saved;
        try {
            saved = repository.save(node);
            if (statusChange) {
                log.info("User {} moved {} {} from {} to {}", user.id(), kind.getKey(), id, previous, target);
            }
            if (statusChange && target != ContentStatus.PUBLISHED) {
                cascade = cascadeService.cascade(id, kind, target, user.id());
            }
        } catch (CascadeFailedException ex) {
            cascade = ex.getPartialResult();
            failedLevel = ex.getFailedLevel();
            throw ex;
        } finally {
            invalidateAfterWrite(kind, id, cascade);
            if (failedLevel != null) {
                cache.invalidate(failedLevel.getCollectionCacheKey());
            }
        }
        return mapper.toDto(saved);
    }

    private void ensureParentPublished(ContentNode node) {
        ContentKind parentKind = node.getKind().parent();
        if (parentKind == null) {
            return;
        }
        ContentNode parent = registry.find(parentKind, node.getParentId())
                .orElseThrow(() -> notFound(parentKind, node.getParentId()));
        if (!parent.isPublished()) {
            throw new ConflictException("Cannot publish " + node.getKind().getKey() + " " + node.getId()
                    + " while its " + parentKind.getKey() + " " + parent.getId() + " is " + parent.getStatus());
        }
    }

    private void ensureSlugAvailable(ContentKind kind, UUID parentId, String slug, UUID excludeId) {
        QuerySpec.Builder spec = QuerySpec.builder().eq("slug", slug);
        if (!kind.isRoot()) {
            spec.eq(kind.getParentAttribute(), parentId);
        }
        if (excludeId != null) {
            spec.neq("id", excludeId);
        }
        if (registry.repository(kind).count(spec.build()) > 0) {
            throw new ConflictException("A " + kind.getKey() + " with slug '" + slug + "' already exists here");
        }
    }

    private void ensureSortOrderAvailable(ContentKind kind, UUID parentId, int sortOrder, UUID excludeId) {
        QuerySpec.Builder spec = QuerySpec.builder().eq("sortOrder", sortOrder);
        if (!kind.isRoot()) {
            spec.eq(kind.getParentAttribute(), parentId);
        }
        if (excludeId != null) {
            spec.neq("id", excludeId);
        }
        if (registry.repository(kind).count(spec.build()) > 0) {
            throw new ConflictException("Sort order " + sortOrder + " is already taken by another " + kind.getKey() + " here");
        }
    }

    private int nextSortOrder(ContentKind kind, UUID parentId) {
        QuerySpec.Builder spec = QuerySpec.builder().orderBy("sortOrder", false).limit(1);
        if (!kind.isRoot()) {
            spec.eq(kind.getParentAttribute(), parentId);
        }
        return registry.repository(kind).select(spec.build()).stream()
                .findFirst()
                .map(last -> Objects.requireNonNullElse(last.getSortOrder(), 0) + 1)
                .orElse(0);
    }

    private void invalidateAfterWrite(ContentKind kind, UUID id, CascadeResult cascade) {
        cache.invalidate(kind.getCollectionCacheKey());
        cache.invalidate(id.toString());
        cache.invalidate(CacheKeys.STATS);
        if (cascade != null) {
            cascade.updated().forEach((level, ids) -> {
                cache.invalidate(level.getCollectionCacheKey());
                ids.forEach(updatedId -> cache.invalidate(updatedId.toString()));
            });
        }
    }

    private boolean canSeeUnpublished() {
        return currentUserResolver.findCurrentUser()
                .map(user -> accessPolicy.hasAny(user, PermissionName.CONTENT_UPDATE))
                .orElse(false);
    }

    private <T> T readThrough(String key, Supplier<T> loader) {
        return cache.getOrLoad(key, () -> {
            try {
                return loader.get();
            } catch (DataAccessException ex) {
                throw new UpstreamServiceException("Failed to load '" + key + "' from the store", ex);
            }
        }, cacheProperties.getContentTtl());
    }

    private static ResourceNotFoundException notFound(ContentKind kind, UUID id) {
        return new ResourceNotFoundException(capitalize(kind.getKey()), id);
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
