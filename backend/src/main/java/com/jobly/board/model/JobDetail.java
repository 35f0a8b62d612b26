package com.jobly.board.model;

import java.math.BigDecimal;

public record JobDetail(
    long id,
    String title,
    Integer salary,
    BigDecimal equity,
    Company company
) {
    public static JobDetail of(Job job, Company company) {
        return new JobDetail(job.id(), job.title(), job.salary(), job.equity(), company);
    }
}
