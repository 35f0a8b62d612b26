package com.jobly.board.sql;

import com.jobly.board.model.CompanySearchCriteria;
import com.jobly.board.model.JobSearchCriteria;

import java.util.List;

/**
 * Search filters for each entity. Field order here is the predicate order in the generated
 * statement.
 */
public final class SearchFilters {

    private static final List<FilterField<CompanySearchCriteria>> COMPANY_FIELDS = List.of(
        FilterField.atLeast("num_employees", CompanySearchCriteria::minEmployees),
        FilterField.atMost("num_employees", CompanySearchCriteria::maxEmployees),
        FilterField.containsNonEmpty("name", CompanySearchCriteria::nameLike)
    );

    private static final List<FilterField<JobSearchCriteria>> JOB_FIELDS = List.of(
        FilterField.atLeast("salary", JobSearchCriteria::minSalary),
        FilterField.whenTrue("equity > 0", JobSearchCriteria::hasEquity),
        FilterField.contains("title", JobSearchCriteria::title)
    );

    public static final FilterPredicateBuilder<CompanySearchCriteria> COMPANIES =
        criteria -> FilterField.collect(COMPANY_FIELDS, criteria);

    public static final FilterPredicateBuilder<JobSearchCriteria> JOBS =
        criteria -> FilterField.collect(JOB_FIELDS, criteria);

    private SearchFilters() {
    }
}
