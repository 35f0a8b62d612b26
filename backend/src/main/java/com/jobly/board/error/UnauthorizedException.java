package com.jobly.board.error;

public class UnauthorizedException extends JoblyException {
    public UnauthorizedException() {
        this("Unauthorized");
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
