package com.example.projectservice.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * System roles. Stored lowercase in {@code user.role} and carried
 * uppercase in JWT role claims.
 */
public enum UserRole {
    STUDENT("student"),
    ADVISOR("advisor"),
    COORDINATOR("coordinator");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static UserRole fromValue(String value) {
        return Arrays.stream(values())
                .filter(role -> role.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown user role: " + value));
    }

    /**
     * Lenient lookup for role claims ("STUDENT", "ROLE_STUDENT", "student").
     */
    public static Optional<UserRole> fromClaim(String claim) {
        if (claim == null) {
            return Optional.empty();
        }
        String normalized = claim.trim().toLowerCase();
        if (normalized.startsWith("role_")) {
            normalized = normalized.substring("role_".length());
        }
        String candidate = normalized;
        return Arrays.stream(values())
                .filter(role -> role.value.equals(candidate))
                .findFirst();
    }
}
