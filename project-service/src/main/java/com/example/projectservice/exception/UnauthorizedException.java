package com.example.projectservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for missing or unusable authentication (HTTP 401).
 */
public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String message) {
        super("UNAUTHORIZED", message, HttpStatus.UNAUTHORIZED);
    }

    public static UnauthorizedException missingEmail() {
        return new UnauthorizedException("Email address missing from authentication token.");
    }

    public static UnauthorizedException missingRole() {
        return new UnauthorizedException("No supported role present in authentication token.");
    }
}
