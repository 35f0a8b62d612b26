package com.jobly.board.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UserDetail(
    String username,
    String firstName,
    String lastName,
    String email,
    @JsonProperty("isAdmin") boolean isAdmin,
    List<AppliedJob> jobs
) {
    public static UserDetail of(User user, List<AppliedJob> jobs) {
        return new UserDetail(
            user.username(),
            user.firstName(),
            user.lastName(),
            user.email(),
            user.isAdmin(),
            jobs
        );
    }
}
