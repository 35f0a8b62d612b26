package com.jobly.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** User created by an admin; may itself be an admin. */
public record NewUser(
    @NotNull @Size(min = 1, max = 25) String username,
    @NotNull @Size(min = 5, max = 20) String password,
    @NotNull @Size(min = 1, max = 30) String firstName,
    @NotNull @Size(min = 1, max = 30) String lastName,
    @NotNull @Email @Size(min = 6, max = 60) String email,
    @JsonProperty("isAdmin") Boolean isAdmin
) {
    public boolean admin() {
        return Boolean.TRUE.equals(isAdmin);
    }
}
