package com.jobly.board.model;

public record Company(
    String handle,
    String name,
    String description,
    Integer numEmployees,
    String logoUrl
) {
}
