package com.jobly.board.model;

public record AppliedJob(
    long id,
    String title,
    String companyHandle,
    String companyName
) {
}
