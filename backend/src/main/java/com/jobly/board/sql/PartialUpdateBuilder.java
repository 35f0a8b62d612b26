package com.jobly.board.sql;

import com.jobly.board.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the SET part of a partial update.
 *
 * <pre>
 * {firstName: "Aliya", age: 32} with {firstName: "first_name"}
 *   =&gt; ["\"first_name\" = $1", "\"age\" = $2"], ["Aliya", 32]
 * </pre>
 *
 * Values are only ever bound to placeholders, never written into the clause text.
 */
public final class PartialUpdateBuilder {
    private PartialUpdateBuilder() {
    }

    public static PartialUpdate build(Map<String, ?> updateSpec, ColumnMap columnMap) {
        if (updateSpec == null || updateSpec.isEmpty()) {
            throw new ValidationException("No data");
        }
        ColumnMap columns = columnMap == null ? ColumnMap.identity() : columnMap;
        List<String> assignments = new ArrayList<>(updateSpec.size());
        List<Object> values = new ArrayList<>(updateSpec.size());
        for (Map.Entry<String, ?> entry : updateSpec.entrySet()) {
            values.add(entry.getValue());
            assignments.add(quoteIdentifier(columns.columnFor(entry.getKey())) + " = $" + values.size());
        }
        return new PartialUpdate(assignments, values);
    }

    static String quoteIdentifier(String column) {
        return "\"" + column.replace("\"", "\"\"") + "\"";
    }
}
