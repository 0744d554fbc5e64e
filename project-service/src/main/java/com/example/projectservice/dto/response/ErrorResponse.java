package com.example.projectservice.dto.response;

import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.BaseException;
import com.example.projectservice.exception.ForbiddenException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body for every non-2xx answer.
 * {@code requiredRoles} is present on role denials, {@code errors} (field to message) on validation failures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String code;
    private String message;
    private List<String> requiredRoles;
    private Map<String, String> errors;
    private Instant timestamp;

    public static ErrorResponse of(String code, String message) {
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .build();
    }

    public static ErrorResponse of(BaseException ex) {
        ErrorResponse response = of(ex.getCode(), ex.getMessage());
        if (ex instanceof ForbiddenException forbidden && !forbidden.getRequiredRoles().isEmpty()) {
            response.setRequiredRoles(forbidden.getRequiredRoles().stream().map(UserRole::name).toList());
        }
        return response;
    }

    public static ErrorResponse validation(Map<String, String> errors) {
        return ErrorResponse.builder()
                .code("VALIDATION_ERROR")
                .message("Validation failed")
                .errors(errors)
                .timestamp(Instant.now())
                .build();
    }
}
