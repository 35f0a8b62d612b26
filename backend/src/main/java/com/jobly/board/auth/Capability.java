package com.jobly.board.auth;

/** Access level a route requires. */
public enum Capability {
    /** Anyone, with or without a token. */
    PUBLIC,
    /** Any caller with a valid token. */
    AUTHENTICATED,
    /** Callers whose token carries the admin flag. */
    ADMIN,
    /** Admins, or the user the route is about (see {@link RequiresCapability#subjectParam()}). */
    ADMIN_OR_SELF
}
