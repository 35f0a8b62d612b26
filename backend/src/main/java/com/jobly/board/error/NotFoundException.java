package com.jobly.board.error;

public class NotFoundException extends JoblyException {
    public NotFoundException(String message) {
        super(message);
    }
}
