package com.jobly.board.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Predicate fragments, combined with AND, and the values for their placeholders in order.
 * Predicates without a placeholder contribute no value.
 */
public record FilterPredicates(List<String> predicates, List<Object> values) {

    public FilterPredicates {
        predicates = List.copyOf(predicates);
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    /** {@code WHERE a AND b}, or an empty string when there is nothing to filter on. */
    public String whereClause() {
        return isEmpty() ? "" : "WHERE " + String.join(" AND ", predicates);
    }
}
