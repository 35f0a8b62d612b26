package com.jobly.board.persistence;

import com.jobly.board.model.Company;
import com.jobly.board.model.CompanySearchCriteria;
import com.jobly.board.model.NewCompany;
import com.jobly.board.sql.ColumnMap;
import com.jobly.board.sql.FilterPredicates;
import com.jobly.board.sql.PartialUpdate;
import com.jobly.board.sql.PartialUpdateBuilder;
import com.jobly.board.sql.SearchFilters;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Repository
public class CompanyJdbcRepository {
    static final ColumnMap COLUMNS = ColumnMap.of(Map.of(
        "numEmployees", "num_employees",
        "logoUrl", "logo_url"
    ));

    private static final String SELECT_COMPANY = """
        SELECT handle,
               name,
               description,
               num_employees,
               logo_url
        FROM companies
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CompanyJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean existsByHandle(String handle) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM companies WHERE handle = :handle",
            new MapSqlParameterSource("handle", handle),
            Integer.class
        );
        return count != null && count > 0;
    }

    public Company insert(NewCompany company) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("handle", company.handle())
            .addValue("name", company.name())
            .addValue("description", company.description())
            .addValue("numEmployees", company.numEmployees(), Types.INTEGER)
            .addValue("logoUrl", company.logoUrl(), Types.VARCHAR);
        jdbc.update(
            """
                INSERT INTO companies (handle, name, description, num_employees, logo_url)
                VALUES (:handle, :name, :description, :numEmployees, :logoUrl)
                """,
            params
        );
        return new Company(
            company.handle(),
            company.name(),
            company.description(),
            company.numEmployees(),
            company.logoUrl()
        );
    }

    public List<Company> findAll(CompanySearchCriteria criteria) {
        FilterPredicates filter = SearchFilters.COMPANIES.build(criteria);
        PositionalStatement statement = PositionalStatement.of(
            SELECT_COMPANY + filter.whereClause() + " ORDER BY name",
            filter.values()
        );
        return jdbc.query(statement.namedSql(), statement.parameters(), companyRowMapper());
    }

    public Company findByHandle(String handle) {
        List<Company> rows = jdbc.query(
            SELECT_COMPANY + "WHERE handle = :handle",
            new MapSqlParameterSource("handle", handle),
            companyRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Applies a partial update keyed by external field names.
     *
     * @return the updated company, or {@code null} when no company has this handle
     */
    public Company update(String handle, Map<String, ?> updateSpec) {
        PartialUpdate update = PartialUpdateBuilder.build(updateSpec, COLUMNS);
        List<Object> values = new ArrayList<>(update.values());
        values.add(handle);
        PositionalStatement statement = PositionalStatement.of(
            "UPDATE companies SET " + update.setClause() + " WHERE handle = $" + update.nextPlaceholder(),
            values
        );
        int rows = jdbc.update(statement.namedSql(), statement.parameters());
        return rows == 0 ? null : findByHandle(handle);
    }

    public boolean delete(String handle) {
        int rows = jdbc.update(
            "DELETE FROM companies WHERE handle = :handle",
            new MapSqlParameterSource("handle", handle)
        );
        return rows > 0;
    }

    private RowMapper<Company> companyRowMapper() {
        return (rs, rowNum) -> new Company(
            rs.getString("handle"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getObject("num_employees", Integer.class),
            rs.getString("logo_url")
        );
    }
}
