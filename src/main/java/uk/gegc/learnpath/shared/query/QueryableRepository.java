package uk.gegc.learnpath.shared.query;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

/**
 * Mixin giving a Spring Data repository {@link QuerySpec}-based reads.
 */
public interface QueryableRepository<T> extends JpaSpecificationExecutor<T> {

    default List<T> select(QuerySpec spec) {
        Specification<T> where = QuerySpecifications.where(spec);
        Sort sort = QuerySpecifications.sort(spec);
        if (spec == null || !spec.isPaged()) {
            return findAll(where, sort);
        }
        if (spec.limit() != null && spec.limit() == 0) {
            return List.of();
        }
        int limit = spec.limit() == null ? Integer.MAX_VALUE : spec.limit();
        return findAll(where, new OffsetBasedPageRequest(spec.offset(), limit, sort)).getContent();
    }

    default long count(QuerySpec spec) {
        return count(QuerySpecifications.<T>where(spec));
    }
}
