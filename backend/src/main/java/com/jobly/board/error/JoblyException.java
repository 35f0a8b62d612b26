package com.jobly.board.error;

/**
 * Base type for the error kinds raised by the board. Carries no transport detail; the web
 * layer decides how each kind is reported.
 */
public abstract class JoblyException extends RuntimeException {
    protected JoblyException(String message) {
        super(message);
    }
}
