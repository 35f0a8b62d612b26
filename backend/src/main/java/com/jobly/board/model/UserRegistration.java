package com.jobly.board.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Self-service sign-up. Registered users are never admins. */
public record UserRegistration(
    @NotNull @Size(min = 1, max = 25) String username,
    @NotNull @Size(min = 5, max = 20) String password,
    @NotNull @Size(min = 1, max = 30) String firstName,
    @NotNull @Size(min = 1, max = 30) String lastName,
    @NotNull @Email @Size(min = 6, max = 60) String email
) {
    public NewUser asNewUser() {
        return new NewUser(username, password, firstName, lastName, email, false);
    }
}
