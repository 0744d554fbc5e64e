package com.example.projectservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException projectNotFound(Long projectId) {
        return new ResourceNotFoundException(
                "PROJECT_NOT_FOUND",
                String.format("Project with ID %s not found", projectId)
        );
    }

    public static ResourceNotFoundException commentNotFound(Long commentId) {
        return new ResourceNotFoundException(
                "COMMENT_NOT_FOUND",
                String.format("Comment with ID %s not found", commentId)
        );
    }

    /**
     * The caller's own account could not be resolved.
     */
    public static ResourceNotFoundException callerNotFound() {
        return new ResourceNotFoundException("USER_NOT_FOUND", "User record not found.");
    }
}
