package com.jobly.board.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * One optional search criterion. A field looks at the criteria and contributes at most one
 * predicate to the collector.
 */
@FunctionalInterface
public interface FilterField<C> {

    void apply(C criteria, Collector collector);

    /** {@code column >= $n} when the value is present. */
    static <C> FilterField<C> atLeast(String column, Function<C, ?> value) {
        return comparison(column, ">=", value);
    }

    /** {@code column <= $n} when the value is present. */
    static <C> FilterField<C> atMost(String column, Function<C, ?> value) {
        return comparison(column, "<=", value);
    }

    /** Case-insensitive substring match when the value is present, empty strings included. */
    static <C> FilterField<C> contains(String column, Function<C, String> value) {
        return (criteria, collector) -> {
            String text = value.apply(criteria);
            if (text != null) {
                collector.add(column + " ILIKE ", "%" + text + "%");
            }
        };
    }

    /** Case-insensitive substring match when the value is present and non-empty. */
    static <C> FilterField<C> containsNonEmpty(String column, Function<C, String> value) {
        return (criteria, collector) -> {
            String text = value.apply(criteria);
            if (text != null && !text.isEmpty()) {
                collector.add(column + " ILIKE ", "%" + text + "%");
            }
        };
    }

    /** A fixed predicate with no value, applied only when the flag is exactly {@code true}. */
    static <C> FilterField<C> whenTrue(String predicate, Function<C, Boolean> flag) {
        return (criteria, collector) -> {
            if (Boolean.TRUE.equals(flag.apply(criteria))) {
                collector.addFixed(predicate);
            }
        };
    }

    private static <C> FilterField<C> comparison(String column, String operator, Function<C, ?> value) {
        return (criteria, collector) -> {
            Object bound = value.apply(criteria);
            if (bound != null) {
                collector.add(column + " " + operator + " ", bound);
            }
        };
    }

    /** Applies the fields in list order, so the output does not depend on how criteria were supplied. */
    static <C> FilterPredicates collect(List<FilterField<C>> fields, C criteria) {
        Collector collector = new Collector();
        if (criteria != null) {
            for (FilterField<C> field : fields) {
                field.apply(criteria, collector);
            }
        }
        return collector.result();
    }

    /** Accumulates predicates and numbers placeholders by the values pushed so far. */
    final class Collector {
        private final List<String> predicates = new ArrayList<>();
        private final List<Object> values = new ArrayList<>();

        void add(String predicatePrefix, Object value) {
            values.add(value);
            predicates.add(predicatePrefix + "$" + values.size());
        }

        void addFixed(String predicate) {
            predicates.add(predicate);
        }

        FilterPredicates result() {
            return new FilterPredicates(predicates, values);
        }
    }
}
