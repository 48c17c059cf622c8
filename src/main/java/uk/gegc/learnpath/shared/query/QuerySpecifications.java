package uk.gegc.learnpath.shared.query;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

public final class QuerySpecifications {

    private QuerySpecifications() {
    }

    public static <T> Specification<T> where(QuerySpec spec) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (spec == null) {
                return cb.and(predicates.toArray(new Predicate[0]));
            }
            for (QueryFilter filter : spec.filters()) {
                predicates.add(toPredicate(root, cb, filter));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Sort sort(QuerySpec spec) {
        if (spec == null || spec.orders().isEmpty()) {
            return Sort.unsorted();
        }
        List<Sort.Order> orders = spec.orders().stream()
                .map(o -> o.ascending() ? Sort.Order.asc(o.attribute()) : Sort.Order.desc(o.attribute()))
                .toList();
        return Sort.by(orders);
    }

    @SuppressWarnings("unchecked")
    private static <T> Predicate toPredicate(Root<T> root, CriteriaBuilder cb, QueryFilter filter) {
        String attribute = filter.attribute();
        Object value = filter.value();
        return switch (filter.operator()) {
            case EQ -> value == null ? cb.isNull(root.get(attribute)) : cb.equal(root.get(attribute), value);
            case NEQ -> value == null ? cb.isNotNull(root.get(attribute)) : cb.notEqual(root.get(attribute), value);
            case IN -> {
                Collection<?> values = (Collection<?>) value;
                yield values.isEmpty() ? cb.disjunction() : root.get(attribute).in(values);
            }
            case GTE -> cb.greaterThanOrEqualTo(root.<Comparable>get(attribute), (Comparable) value);
            case LTE -> cb.lessThanOrEqualTo(root.<Comparable>get(attribute), (Comparable) value);
            case LIKE -> cb.like(cb.lower(root.get(attribute)),
                    "%" + String.valueOf(value).toLowerCase(Locale.ROOT) + "%");
        };
    }
}
