package com.example.projectservice.exception;

import com.example.projectservice.entity.ProjectStatus;
import org.springframework.http.HttpStatus;

/**
 * Exception for conflict errors (HTTP 409).
 *
 * Used for:
 * - Optimistic locking conflicts (concurrent updates detected)
 * - Status transitions the workflow does not allow
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public ConflictException(String code, String message, Throwable cause) {
        super(code, message, HttpStatus.CONFLICT, cause);
    }

    public static ConflictException concurrentModification(Throwable cause) {
        return new ConflictException("CONCURRENT_MODIFICATION",
                "Project was modified by another user. Please refresh and retry.", cause);
    }

    public static ConflictException invalidTransition(ProjectStatus from, ProjectStatus to) {
        return new ConflictException("INVALID_STATUS_TRANSITION",
                String.format("Cannot move a project from %s to %s",
                        from.getDisplayName(), to.getDisplayName()));
    }
}
