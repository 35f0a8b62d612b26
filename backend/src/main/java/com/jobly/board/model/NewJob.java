package com.jobly.board.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record NewJob(
    @NotNull @Size(min = 1) String title,
    @Min(0) Integer salary,
    @DecimalMin("0") @DecimalMax("1.0") BigDecimal equity,
    @NotNull @Size(min = 1, max = 25) String companyHandle
) {
}
