package com.jobly.board.model;

import jakarta.validation.constraints.Min;

public record CompanySearchCriteria(
    @Min(0) Integer minEmployees,
    @Min(0) Integer maxEmployees,
    String nameLike
) {
}
