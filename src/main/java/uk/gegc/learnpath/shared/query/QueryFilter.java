package uk.gegc.learnpath.shared.query;

import java.util.Collection;
import java.util.Objects;

/**
 * Single predicate on an entity attribute. {@code IN} filters carry a collection value,
 * {@code LIKE} filters a case-insensitive substring.
 */
public record QueryFilter(String attribute, QueryOperator operator, Object value) {

    public QueryFilter {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(operator, "operator");
        if (operator == QueryOperator.IN && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN filter on '" + attribute + "' requires a collection value");
        }
    }
}
