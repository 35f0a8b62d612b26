package com.jobly.board.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Reads the {@code Authorization: Bearer ...} header and, when the token verifies, stores
 * the identity on the request. A missing or invalid token is not an error here; routes that
 * need an identity reject the request later.
 */
@Component
public class BearerTokenFilter extends OncePerRequestFilter {
    private static final Pattern BEARER_PREFIX = Pattern.compile("^[Bb]earer ");

    private final TokenCodec tokenCodec;

    public BearerTokenFilter(TokenCodec tokenCodec) {
        this.tokenCodec = tokenCodec;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && !header.isBlank()) {
            String token = BEARER_PREFIX.matcher(header).replaceFirst("").trim();
            tokenCodec.decode(token).ifPresent(identity -> RequestIdentity.set(request, identity));
        }
        filterChain.doFilter(request, response);
    }
}
