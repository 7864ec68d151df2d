package com.hieshield.frauddetector.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private final JwtService jwt;

    public JwtAuthFilter(JwtService jwt) {
        this.jwt = jwt;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();
        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }
        return path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-ui")
                || path.equals("/actuator/health");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        try {
            authenticate(request, method, path);
        } catch (Exception e) {
            log.error("JwtAuthFilter: Error in JWT filter for {} {}: {}", method, path, e.getMessage(), e);
            SecurityContextHolder.clearContext();
        }
        // unauthenticated requests are answered 401 by Spring Security
        chain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String method, String path) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            log.debug("JwtAuthFilter: No bearer token for: {} {}", method, path);
            return;
        }

        String token = authHeader.substring(7).trim();
        var subjectOpt = jwt.getSubject(token);
        if (subjectOpt.isEmpty()) {
            log.warn("JwtAuthFilter: Invalid or expired token for: {} {}", method, path);
            return;
        }

        String subject = subjectOpt.get();
        Set<SimpleGrantedAuthority> authorities = jwt.getRoles(token).stream()
                .map(role -> role.startsWith("ROLE_") ? role : "ROLE_" + role)
                .map(SimpleGrantedAuthority::new)
                .collect(Collectors.toSet());

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(subject, null, authorities);
        jwt.getHospitalId(token).ifPresent(h -> authentication.setDetails(Map.of("hospitalId", h)));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        log.info("JwtAuthFilter: Authenticated {} with authorities {} for {} {}", subject, authorities, method, path);
    }
}
