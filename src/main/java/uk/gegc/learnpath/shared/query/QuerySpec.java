package uk.gegc.learnpath.shared.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Store-agnostic description of a select: conjunction of filters, ordering and an optional window.
 * Repositories implementing {@link QueryableRepository} translate it into JPA criteria.
 */
public record QuerySpec(List<QueryFilter> filters, List<QueryOrder> orders, Integer limit, int offset) {

    public QuerySpec {
        filters = filters == null ? List.of() : List.copyOf(filters);
        orders = orders == null ? List.of() : List.copyOf(orders);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public static QuerySpec all() {
        return new QuerySpec(List.of(), List.of(), null, 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPaged() {
        return limit != null || offset > 0;
    }

    /**
     * Deterministic textual form, suitable as a cache key suffix.
     */
    public String cacheKey() {
        String where = filters.stream()
                .map(f -> f.attribute() + ":" + f.operator().name().toLowerCase() + ":" + f.value())
                .collect(Collectors.joining(","));
        String order = orders.stream()
                .map(o -> o.attribute() + (o.ascending() ? ":asc" : ":desc"))
                .collect(Collectors.joining(","));
        return "[" + where + "][" + order + "][" + (limit == null ? "-" : limit) + ":" + offset + "]";
    }

    public static final class Builder {
        private final List<QueryFilter> filters = new ArrayList<>();
        private final List<QueryOrder> orders = new ArrayList<>();
        private Integer limit;
        private int offset;

        private Builder() {
        }

        public Builder eq(String attribute, Object value) {
            filters.add(new QueryFilter(attribute, QueryOperator.EQ, value));
            return this;
        }

        public Builder neq(String attribute, Object value) {
            filters.add(new QueryFilter(attribute, QueryOperator.NEQ, value));
            return this;
        }

        public Builder in(String attribute, Collection<?> values) {
            filters.add(new QueryFilter(attribute, QueryOperator.IN, List.copyOf(values)));
            return this;
        }

        public Builder gte(String attribute, Comparable<?> value) {
            filters.add(new QueryFilter(attribute, QueryOperator.GTE, value));
            return this;
        }

        public Builder lte(String attribute, Comparable<?> value) {
            filters.add(new QueryFilter(attribute, QueryOperator.LTE, value));
            return this;
        }

        public Builder like(String attribute, String fragment) {
            filters.add(new QueryFilter(attribute, QueryOperator.LIKE, fragment));
            return this;
        }

        public Builder orderBy(String attribute, boolean ascending) {
            orders.add(new QueryOrder(attribute, ascending));
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(filters, orders, limit, offset);
        }
    }
}
