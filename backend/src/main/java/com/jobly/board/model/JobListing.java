package com.jobly.board.model;

import java.math.BigDecimal;

public record JobListing(
    long id,
    String title,
    Integer salary,
    BigDecimal equity,
    String companyHandle,
    String companyName
) {
}
