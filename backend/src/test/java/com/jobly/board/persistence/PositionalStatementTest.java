package com.jobly.board.persistence;

import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PositionalStatementTest {

    @Test
    void rewritesPlaceholdersToNamedParameters() {
        PositionalStatement statement = PositionalStatement.of(
            "UPDATE jobs SET \"title\" = $1, \"salary\" = $2 WHERE id = $3",
            List.of("Dev", 100, 7L)
        );

        assertEquals("UPDATE jobs SET \"title\" = :p1, \"salary\" = :p2 WHERE id = :p3", statement.namedSql());
        MapSqlParameterSource params = statement.parameters();
        assertEquals("Dev", params.getValue("p1"));
        assertEquals(100, params.getValue("p2"));
        assertEquals(7L, params.getValue("p3"));
    }

    @Test
    void multiDigitPlaceholdersKeepTheirIndex() {
        List<Object> values = Arrays.asList(new Object[11]);
        PositionalStatement statement = PositionalStatement.of("SELECT $1, $10, $11", values);

        assertEquals("SELECT :p1, :p10, :p11", statement.namedSql());
    }

    @Test
    void nullValuesAreBound() {
        PositionalStatement statement = PositionalStatement.of("SELECT $1", Arrays.asList((Object) null));

        assertEquals(1, statement.values().size());
        assertNull(statement.parameters().getValue("p1"));
    }

    @Test
    void placeholderWithoutValueIsRejected() {
        PositionalStatement statement = PositionalStatement.of("SELECT $1, $2", List.of(1));

        assertThatThrownBy(statement::namedSql)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("$2");
    }
}
