package com.jobly.board.auth;

import jakarta.servlet.http.HttpServletRequest;

/** Where the decoded identity lives for the rest of a request. */
public final class RequestIdentity {
    public static final String ATTRIBUTE = RequestIdentity.class.getName() + ".identity";

    private RequestIdentity() {
    }

    public static void set(HttpServletRequest request, IdentityClaim identity) {
        request.setAttribute(ATTRIBUTE, identity);
    }

    /** The caller's identity, or {@code null} when the request carried no valid token. */
    public static IdentityClaim get(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof IdentityClaim identity ? identity : null;
    }
}
