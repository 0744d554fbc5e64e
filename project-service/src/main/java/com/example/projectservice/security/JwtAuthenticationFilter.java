package com.example.projectservice.security;

import com.example.projectservice.entity.UserRole;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Authenticates requests carrying a Bearer token.
 * Roles are normalized to ROLE_STUDENT, ROLE_ADVISOR and ROLE_COORDINATOR; unknown roles are dropped.
 * Requests without a valid token continue unauthenticated and are rejected by the security chain.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String AUTH_HEADER = "Authorization";

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(AUTH_HEADER);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        final String jwt = authHeader.substring(BEARER_PREFIX.length());

        if (jwtService.isTokenValid(jwt)) {
            Long userId = jwtService.extractUserId(jwt);
            String email = jwtService.extractEmail(jwt);
            List<SimpleGrantedAuthority> authorities = jwtService.extractRoles(jwt).stream()
                    .map(UserRole::fromClaim)
                    .flatMap(Optional::stream)
                    .distinct()
                    .map(role -> new SimpleGrantedAuthority("ROLE_" + role.getValue().toUpperCase(Locale.ROOT)))
                    .toList();

            CurrentUser currentUser = new CurrentUser(userId, email, authorities);

            UsernamePasswordAuthenticationToken authToken =
                    new UsernamePasswordAuthenticationToken(currentUser, null, authorities);
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

            SecurityContextHolder.getContext().setAuthentication(authToken);

            log.debug("JWT authentication successful: userId={}, roles={}", userId, authorities);
        }

        filterChain.doFilter(request, response);
    }
}
