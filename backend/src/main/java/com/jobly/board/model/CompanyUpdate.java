package com.jobly.board.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sparse company patch; {@code null} means "leave unchanged". The handle is not updatable. */
public record CompanyUpdate(
    @Size(min = 1) String name,
    String description,
    @Min(0) Integer numEmployees,
    @URL String logoUrl
) {
    public Map<String, Object> toUpdateSpec() {
        Map<String, Object> spec = new LinkedHashMap<>();
        UpdateSpecs.putIfPresent(spec, "name", name);
        UpdateSpecs.putIfPresent(spec, "description", description);
        UpdateSpecs.putIfPresent(spec, "numEmployees", numEmployees);
        UpdateSpecs.putIfPresent(spec, "logoUrl", logoUrl);
        return spec;
    }
}
