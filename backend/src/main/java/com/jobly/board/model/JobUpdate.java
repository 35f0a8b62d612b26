package com.jobly.board.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** Sparse job patch. Id and company are fixed once a job exists. */
public record JobUpdate(
    @Size(min = 1) String title,
    @Min(0) Integer salary,
    @DecimalMin("0") @DecimalMax("1.0") BigDecimal equity
) {
    public Map<String, Object> toUpdateSpec() {
        Map<String, Object> spec = new LinkedHashMap<>();
        UpdateSpecs.putIfPresent(spec, "title", title);
        UpdateSpecs.putIfPresent(spec, "salary", salary);
        UpdateSpecs.putIfPresent(spec, "equity", equity);
        return spec;
    }
}
