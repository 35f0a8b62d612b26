package com.jobly.board.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record Credentials(
    @NotNull @Size(min = 1) String username,
    @NotNull @Size(min = 1) String password
) {
}
