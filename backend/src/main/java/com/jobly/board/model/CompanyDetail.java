package com.jobly.board.model;

import java.util.List;

public record CompanyDetail(
    String handle,
    String name,
    String description,
    Integer numEmployees,
    String logoUrl,
    List<JobSummary> jobs
) {
    public static CompanyDetail of(Company company, List<JobSummary> jobs) {
        return new CompanyDetail(
            company.handle(),
            company.name(),
            company.description(),
            company.numEmployees(),
            company.logoUrl(),
            jobs
        );
    }
}
