package com.jobly.board.auth;

/**
 * Who the caller is, as vouched for by a verified bearer token.
 *
 * @param subjectId the username the token was issued to
 * @param isAdmin   whether the token grants admin rights
 */
public record IdentityClaim(String subjectId, boolean isAdmin) {
}
