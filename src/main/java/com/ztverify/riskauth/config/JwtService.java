package com.ztverify.riskauth.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.*;

/**
 * Issues and reads the session tokens handed out after an allowed (or OTP-completed) login.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    public static final String AUTH_METHOD_RISK = "risk";
    public static final String AUTH_METHOD_OTP = "otp";

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    public String generateToken(String username, Set<String> roles, String authMethod) {
        Instant now = Instant.now();
        String token = Jwts.builder()
                .setSubject(username)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim("roles", roles == null ? List.of() : new ArrayList<>(roles))
                .claim("amr", authMethod)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
        log.debug("Generated JWT for {} (roles: {}, method: {})", username, roles, authMethod);
        return token;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Set<String> getRoles(String token) {
        try {
            Object rolesObj = parse(token).getBody().get("roles");
            if (rolesObj instanceof Collection<?> col) {
                Set<String> roles = new HashSet<>();
                for (Object o : col) {
                    roles.add(String.valueOf(o));
                }
                return roles;
            }
            return Set.of();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public Optional<String> getAuthMethod(String token) {
        try {
            Object amr = parse(token).getBody().get("amr");
            return Optional.ofNullable(amr == null ? null : String.valueOf(amr));
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean isTokenExpired(String token) {
        try {
            return parse(token).getBody().getExpiration().before(new Date());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return true;
        }
    }
}
