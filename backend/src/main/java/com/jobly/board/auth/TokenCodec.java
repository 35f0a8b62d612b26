package com.jobly.board.auth;

import com.jobly.config.JoblyProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Signs identity claims into bearer tokens and verifies them again.
 *
 * <p>Tokens carry exactly two claims, {@code username} and {@code isAdmin}, and do not
 * expire. The HMAC key comes from {@code jobly.auth.secret-key} and is fixed for the life of
 * the process.
 */
@Component
public class TokenCodec {
    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);
    static final String USERNAME_CLAIM = "username";
    static final String IS_ADMIN_CLAIM = "isAdmin";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey key;
    private final JwtParser parser;

    public TokenCodec(JoblyProperties properties) {
        String secretKey = properties.getAuth().getSecretKey();
        if (secretKey == null || secretKey.getBytes(StandardCharsets.UTF_8).length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jobly.auth.secret-key must be at least " + MIN_KEY_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser().verifyWith(key).build();
    }

    public String encode(IdentityClaim identity) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(identity.subjectId(), "identity.subjectId");
        return Jwts.builder()
            .claim(USERNAME_CLAIM, identity.subjectId())
            .claim(IS_ADMIN_CLAIM, identity.isAdmin())
            .signWith(key, Jwts.SIG.HS256)
            .compact();
    }

    /**
     * Returns the verified identity, or empty when the token is missing, malformed, badly
     * signed or lacks a username. Never throws: a bad token is the same as no token.
     */
    public Optional<IdentityClaim> decode(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Ignoring unverifiable bearer token: {}", ex.getClass().getSimpleName());
            return Optional.empty();
        }
        Object username = claims.get(USERNAME_CLAIM);
        if (!(username instanceof String subjectId) || subjectId.isEmpty()) {
            log.debug("Ignoring bearer token without a username claim");
            return Optional.empty();
        }
        boolean admin = Boolean.TRUE.equals(claims.get(IS_ADMIN_CLAIM));
        return Optional.of(new IdentityClaim(subjectId, admin));
    }
}
