package com.hieshield.frauddetector.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.*;

/**
 * Reads the bearer tokens the HIE portal issues to clinicians; this service never mints them.
 * Tokens carry the user's roles and, for hospital staff, their hospital id.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;

    public JwtService(@Value("${security.jwt.secret}") String secret) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        log.info("JWT service initialized for HS256 bearer tokens");
    }

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Role names upper-cased, without the ROLE_ prefix. Accepts the single "role" claim of older tokens. */
    public Set<String> getRoles(String token) {
        try {
            Claims claims = parse(token).getBody();
            Set<String> roles = new HashSet<>();
            Object rolesObj = claims.get("roles");
            if (rolesObj instanceof Collection<?> col) {
                for (Object o : col) {
                    roles.add(String.valueOf(o).toUpperCase(Locale.ROOT));
                }
            }
            Object single = claims.get("role");
            if (single != null) {
                roles.add(String.valueOf(single).toUpperCase(Locale.ROOT));
            }
            return roles;
        } catch (Exception e) {
            log.warn("Failed to extract roles from token: {}", e.getMessage());
            return Set.of();
        }
    }

    public Optional<String> getHospitalId(String token) {
        try {
            Object hospitalId = parse(token).getBody().get("hospitalId");
            return Optional.ofNullable(hospitalId).map(String::valueOf);
        } catch (Exception e) {
            log.warn("Failed to extract hospital ID from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isTokenExpired(String token) {
        try {
            return parse(token).getBody().getExpiration().before(new Date());
        } catch (Exception e) {
            log.debug("Token validation failed: {}", e.getMessage());
            return true;
        }
    }
}
