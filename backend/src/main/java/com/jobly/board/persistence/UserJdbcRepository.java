package com.jobly.board.persistence;

import com.jobly.board.model.AppliedJob;
import com.jobly.board.model.NewUser;
import com.jobly.board.model.User;
import com.jobly.board.sql.ColumnMap;
import com.jobly.board.sql.PartialUpdate;
import com.jobly.board.sql.PartialUpdateBuilder;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Repository
public class UserJdbcRepository {
    static final ColumnMap COLUMNS = ColumnMap.of(Map.of(
        "firstName", "first_name",
        "lastName", "last_name",
        "isAdmin", "is_admin"
    ));

    private static final String SELECT_USER = """
        SELECT username,
               first_name,
               last_name,
               email,
               is_admin
        FROM users
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public UserJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean existsByUsername(String username) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE username = :username",
            new MapSqlParameterSource("username", username),
            Integer.class
        );
        return count != null && count > 0;
    }

    public User insert(NewUser user, String passwordHash) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("username", user.username())
            .addValue("password", passwordHash)
            .addValue("firstName", user.firstName())
            .addValue("lastName", user.lastName())
            .addValue("email", user.email())
            .addValue("isAdmin", user.admin());
        jdbc.update(
            """
                INSERT INTO users (username, password, first_name, last_name, email, is_admin)
                VALUES (:username, :password, :firstName, :lastName, :email, :isAdmin)
                """,
            params
        );
        return new User(user.username(), user.firstName(), user.lastName(), user.email(), user.admin());
    }

    /** Stored password hash, or {@code null} for an unknown user. */
    public String findPasswordHash(String username) {
        List<String> rows = jdbc.query(
            "SELECT password FROM users WHERE username = :username",
            new MapSqlParameterSource("username", username),
            (rs, rowNum) -> rs.getString("password")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<User> findAll() {
        return jdbc.query(SELECT_USER + "ORDER BY username", userRowMapper());
    }

    public User findByUsername(String username) {
        List<User> rows = jdbc.query(
            SELECT_USER + "WHERE username = :username",
            new MapSqlParameterSource("username", username),
            userRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Applies a partial update keyed by external field names. Password values must already be
     * hashed.
     *
     * @return the updated user, or {@code null} when the user does not exist
     */
    public User update(String username, Map<String, ?> updateSpec) {
        PartialUpdate update = PartialUpdateBuilder.build(updateSpec, COLUMNS);
        List<Object> values = new ArrayList<>(update.values());
        values.add(username);
        PositionalStatement statement = PositionalStatement.of(
            "UPDATE users SET " + update.setClause() + " WHERE username = $" + update.nextPlaceholder(),
            values
        );
        int rows = jdbc.update(statement.namedSql(), statement.parameters());
        return rows == 0 ? null : findByUsername(username);
    }

    public boolean delete(String username) {
        int rows = jdbc.update(
            "DELETE FROM users WHERE username = :username",
            new MapSqlParameterSource("username", username)
        );
        return rows > 0;
    }

    public boolean hasApplied(String username, long jobId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM applications WHERE username = :username AND job_id = :jobId",
            new MapSqlParameterSource().addValue("username", username).addValue("jobId", jobId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public void insertApplication(String username, long jobId) {
        jdbc.update(
            "INSERT INTO applications (username, job_id) VALUES (:username, :jobId)",
            new MapSqlParameterSource().addValue("username", username).addValue("jobId", jobId)
        );
    }

    public List<AppliedJob> findApplications(String username) {
        return jdbc.query(
            """
                SELECT j.id,
                       j.title,
                       j.company_handle,
                       c.name AS company_name
                FROM applications a
                JOIN jobs j ON j.id = a.job_id
                LEFT JOIN companies c ON c.handle = j.company_handle
                WHERE a.username = :username
                ORDER BY j.id
                """,
            new MapSqlParameterSource("username", username),
            (rs, rowNum) -> new AppliedJob(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getString("company_handle"),
                rs.getString("company_name")
            )
        );
    }

    private RowMapper<User> userRowMapper() {
        return (rs, rowNum) -> new User(
            rs.getString("username"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("email"),
            rs.getBoolean("is_admin")
        );
    }
}
