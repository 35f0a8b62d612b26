package com.jobly.board.model;

import java.math.BigDecimal;

public record JobSummary(
    long id,
    String title,
    Integer salary,
    BigDecimal equity
) {
}
