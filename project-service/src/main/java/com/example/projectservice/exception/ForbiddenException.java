package com.example.projectservice.exception;

import com.example.projectservice.entity.UserRole;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception for forbidden access (HTTP 403).
 * The caller is authenticated but its role or assignment does not allow the action.
 */
@Getter
public class ForbiddenException extends BaseException {

    /**
     * Roles that may perform the action; empty when the denial is about assignment, not role.
     */
    private final List<UserRole> requiredRoles;

    public ForbiddenException(String code, String message) {
        this(code, message, List.of());
    }

    public ForbiddenException(String message) {
        this("FORBIDDEN", message);
    }

    private ForbiddenException(String code, String message, List<UserRole> requiredRoles) {
        super(code, message, HttpStatus.FORBIDDEN);
        this.requiredRoles = requiredRoles;
    }

    /**
     * Role not allowed for this operation.
     */
    public static ForbiddenException roleNotAllowed(UserRole... allowed) {
        return roleNotAllowed(String.format("This action requires %s role", describe(List.of(allowed))), allowed);
    }

    public static ForbiddenException roleNotAllowed(String message, UserRole... allowed) {
        return new ForbiddenException("ROLE_NOT_ALLOWED", message, List.of(allowed));
    }

    public static ForbiddenException advisorNotAssigned() {
        return new ForbiddenException("ADVISOR_NOT_ASSIGNED",
                "You are not assigned as the advisor for this project.");
    }

    public static ForbiddenException notProjectMember() {
        return new ForbiddenException("NOT_PROJECT_MEMBER",
                "You are not a member of this project.");
    }

    public static ForbiddenException advisorCannotEditProject() {
        return roleNotAllowed("Advisors cannot update project details.", UserRole.STUDENT, UserRole.COORDINATOR);
    }

    public static ForbiddenException notCommentAuthor() {
        return new ForbiddenException("NOT_COMMENT_AUTHOR",
                "You can only delete your own comments.");
    }

    // "STUDENT", "STUDENT or COORDINATOR", "STUDENT, ADVISOR or COORDINATOR"
    private static String describe(List<UserRole> roles) {
        if (roles.size() == 1) {
            return roles.get(0).name();
        }
        String head = roles.subList(0, roles.size() - 1).stream()
                .map(UserRole::name)
                .collect(Collectors.joining(", "));
        return head + " or " + roles.get(roles.size() - 1).name();
    }
}
