package com.jobly.board.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assignment fragments for an UPDATE statement and the values bound to their placeholders.
 * {@code assignments.get(i)} uses placeholder {@code $(i + 1)}, bound to {@code values.get(i)}.
 */
public record PartialUpdate(List<String> assignments, List<Object> values) {

    public PartialUpdate {
        assignments = List.copyOf(assignments);
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String setClause() {
        return String.join(", ", assignments);
    }

    /** Index of the first placeholder free for the caller's own parameters. */
    public int nextPlaceholder() {
        return values.size() + 1;
    }
}
