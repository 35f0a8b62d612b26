package com.jobly.board.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

import java.util.LinkedHashMap;
import java.util.Map;

/** Sparse user patch. Username and admin flag cannot be changed here. */
public record UserUpdate(
    @Size(min = 1, max = 30) String firstName,
    @Size(min = 1, max = 30) String lastName,
    @Size(min = 5, max = 20) String password,
    @Email @Size(min = 6, max = 60) String email
) {
    /** Changed fields keyed by field name, with the plain-text password replaced by {@code passwordHash}. */
    public Map<String, Object> toUpdateSpec(String passwordHash) {
        Map<String, Object> spec = new LinkedHashMap<>();
        UpdateSpecs.putIfPresent(spec, "firstName", firstName);
        UpdateSpecs.putIfPresent(spec, "lastName", lastName);
        UpdateSpecs.putIfPresent(spec, "password", password == null ? null : passwordHash);
        UpdateSpecs.putIfPresent(spec, "email", email);
        return spec;
    }
}
