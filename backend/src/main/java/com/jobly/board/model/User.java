package com.jobly.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record User(
    String username,
    String firstName,
    String lastName,
    String email,
    @JsonProperty("isAdmin") boolean isAdmin
) {
}
