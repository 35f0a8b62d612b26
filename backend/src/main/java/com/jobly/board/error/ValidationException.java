package com.jobly.board.error;

/** Caller-supplied data is malformed: empty update, conflicting bounds, schema mismatch. */
public class ValidationException extends JoblyException {
    public ValidationException(String message) {
        super(message);
    }
}
