package com.jobly.board.persistence;

import com.jobly.board.model.Job;
import com.jobly.board.model.JobListing;
import com.jobly.board.model.JobSearchCriteria;
import com.jobly.board.model.JobSummary;
import com.jobly.board.model.NewJob;
import com.jobly.board.sql.ColumnMap;
import com.jobly.board.sql.FilterPredicates;
import com.jobly.board.sql.PartialUpdate;
import com.jobly.board.sql.PartialUpdateBuilder;
import com.jobly.board.sql.SearchFilters;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Repository
public class JobJdbcRepository {
    static final ColumnMap COLUMNS = ColumnMap.identity();

    private static final String SELECT_JOB = """
        SELECT id,
               title,
               salary,
               equity,
               company_handle
        FROM jobs
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public JobJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Job insert(NewJob job) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("title", job.title())
            .addValue("salary", job.salary(), Types.INTEGER)
            .addValue("equity", job.equity(), Types.NUMERIC)
            .addValue("companyHandle", job.companyHandle());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO jobs (title, salary, equity, company_handle)
                VALUES (:title, :salary, :equity, :companyHandle)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for job " + job.title());
        }
        return findById(key.longValue());
    }

    public List<JobListing> findAll(JobSearchCriteria criteria) {
        FilterPredicates filter = SearchFilters.JOBS.build(criteria);
        PositionalStatement statement = PositionalStatement.of(
            """
                SELECT j.id,
                       j.title,
                       j.salary,
                       j.equity,
                       j.company_handle,
                       c.name AS company_name
                FROM jobs j
                LEFT JOIN companies c ON c.handle = j.company_handle
                """ + filter.whereClause() + " ORDER BY j.title, j.id",
            filter.values()
        );
        return jdbc.query(
            statement.namedSql(),
            statement.parameters(),
            (rs, rowNum) -> new JobListing(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getObject("salary", Integer.class),
                rs.getBigDecimal("equity"),
                rs.getString("company_handle"),
                rs.getString("company_name")
            )
        );
    }

    public Job findById(long id) {
        List<Job> rows = jdbc.query(
            SELECT_JOB + "WHERE id = :id",
            new MapSqlParameterSource("id", id),
            jobRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<JobSummary> findSummariesByCompany(String companyHandle) {
        return jdbc.query(
            """
                SELECT id, title, salary, equity
                FROM jobs
                WHERE company_handle = :handle
                ORDER BY id
                """,
            new MapSqlParameterSource("handle", companyHandle),
            (rs, rowNum) -> new JobSummary(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getObject("salary", Integer.class),
                rs.getBigDecimal("equity")
            )
        );
    }

    /**
     * Applies a partial update keyed by external field names.
     *
     * @return the updated job, or {@code null} when no job has this id
     */
    public Job update(long id, Map<String, ?> updateSpec) {
        PartialUpdate update = PartialUpdateBuilder.build(updateSpec, COLUMNS);
        List<Object> values = new ArrayList<>(update.values());
        values.add(id);
        PositionalStatement statement = PositionalStatement.of(
            "UPDATE jobs SET " + update.setClause() + " WHERE id = $" + update.nextPlaceholder(),
            values
        );
        int rows = jdbc.update(statement.namedSql(), statement.parameters());
        return rows == 0 ? null : findById(id);
    }

    public boolean delete(long id) {
        return jdbc.update("DELETE FROM jobs WHERE id = :id", new MapSqlParameterSource("id", id)) > 0;
    }

    private RowMapper<Job> jobRowMapper() {
        return (rs, rowNum) -> new Job(
            rs.getLong("id"),
            rs.getString("title"),
            rs.getObject("salary", Integer.class),
            rs.getBigDecimal("equity"),
            rs.getString("company_handle")
        );
    }
}
