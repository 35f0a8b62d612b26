package com.jobly.board.persistence;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL text with {@code $1 .. $n} placeholders plus the values for them, in order.
 *
 * <p>{@code NamedParameterJdbcTemplate} has no positional {@code $n} syntax, so each
 * {@code $n} is rewritten to {@code :pn} and value {@code n - 1} is bound under that name.
 * A placeholder may appear more than once; every one must have a value.
 *
 * @see org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate
 */
public record PositionalStatement(String sql, List<Object> values) {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    public PositionalStatement {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static PositionalStatement of(String sql, List<?> values) {
        return new PositionalStatement(sql, new ArrayList<>(values));
    }

    public String namedSql() {
        Matcher matcher = PLACEHOLDER.matcher(sql);
        StringBuilder out = new StringBuilder(sql.length());
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            if (index < 1 || index > values.size()) {
                throw new IllegalArgumentException(
                    "Placeholder $" + index + " has no value (" + values.size() + " bound)"
                );
            }
            matcher.appendReplacement(out, ":p" + index);
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public MapSqlParameterSource parameters() {
        MapSqlParameterSource params = new MapSqlParameterSource();
        for (int i = 0; i < values.size(); i++) {
            params.addValue("p" + (i + 1), values.get(i));
        }
        return params;
    }
}
