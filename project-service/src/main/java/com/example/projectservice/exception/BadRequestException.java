package com.example.projectservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Validation failure on caller input (HTTP 400).
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static BadRequestException validation(String message) {
        return new BadRequestException("VALIDATION_ERROR", message);
    }

    public static BadRequestException noValidStudentMembers() {
        return validation("No valid student members found for project submission.");
    }

    public static BadRequestException unsupportedGrade(String grade) {
        return new BadRequestException("INVALID_GRADE",
                String.format("Unsupported grade value: %s", grade));
    }
}
