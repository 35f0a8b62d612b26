package com.jobly.board.sql;

/** Turns an entity's search criteria into predicate fragments and their positional values. */
@FunctionalInterface
public interface FilterPredicateBuilder<C> {
    FilterPredicates build(C criteria);
}
