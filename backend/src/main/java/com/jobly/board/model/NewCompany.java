package com.jobly.board.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

public record NewCompany(
    @NotNull @Size(min = 1, max = 25) String handle,
    @NotNull @Size(min = 1) String name,
    @NotNull String description,
    @Min(0) Integer numEmployees,
    @URL String logoUrl
) {
}
