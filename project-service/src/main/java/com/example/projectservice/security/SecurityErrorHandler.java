package com.example.projectservice.security;

import com.example.projectservice.dto.response.ErrorResponse;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.ForbiddenException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON bodies for requests the filter chain rejects before any controller runs.
 * Missing or invalid tokens get 401 UNAUTHORIZED. Route role gates get 403 ROLE_NOT_ALLOWED
 * naming the role, the same body a service-level role denial produces.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        log.debug("Unauthenticated request rejected: {} {}", request.getMethod(), request.getRequestURI());
        write(response, HttpStatus.UNAUTHORIZED,
                ErrorResponse.of("UNAUTHORIZED", "A valid bearer token is required"));
    }

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, HttpStatus.FORBIDDEN,
                ErrorResponse.of("FORBIDDEN", "You do not have permission to perform this action"));
    }

    /**
     * Denial handler for a route only {@code role} may call.
     */
    public AccessDeniedHandler requiringRole(UserRole role) {
        return (request, response, accessDeniedException) -> {
            log.warn("Route requires {}: {} {}", role, request.getMethod(), request.getRequestURI());
            ForbiddenException denial = ForbiddenException.roleNotAllowed(role);
            write(response, denial.getStatus(), ErrorResponse.of(denial));
        };
    }

    private void write(HttpServletResponse response, HttpStatus status, ErrorResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
