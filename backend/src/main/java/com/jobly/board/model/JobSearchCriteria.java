package com.jobly.board.model;

import jakarta.validation.constraints.Min;

/**
 * Job search filters. {@code hasEquity} narrows to jobs with equity only when it is
 * {@code true}; {@code false} and {@code null} both mean "any".
 */
public record JobSearchCriteria(
    @Min(0) Integer minSalary,
    Boolean hasEquity,
    String title
) {
}
