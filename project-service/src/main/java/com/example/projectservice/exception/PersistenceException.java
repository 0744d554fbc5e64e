package com.example.projectservice.exception;

import org.springframework.http.HttpStatus;

/**
 * A call into the table store failed (HTTP 500).
 * Carries the original store error as its cause.
 */
public class PersistenceException extends BaseException {

    public PersistenceException(String operation, Throwable cause) {
        super("PERSISTENCE_ERROR", String.format("Store operation failed: %s", operation),
                HttpStatus.INTERNAL_SERVER_ERROR, cause);
    }
}
