package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * User Deleted Event
 *
 * Published by: user management when an account is hard deleted.
 * Consumed by:
 * - Project Service: clears advisor references on projects (projects are never deleted)
 *
 * Event Flow:
 * 1. Coordinator deletes a user account
 * 2. User management publishes UserDeletedEvent on topic "user.deleted"
 * 3. Consumers drop or null out their weak references to the user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDeletedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Id of the deleted user
     */
    private Long userId;

    /**
     * E-mail of the deleted user (logging only)
     */
    private String email;

    /**
     * Role of the deleted user: student, advisor or coordinator
     */
    private String role;

    /**
     * When the account was removed
     */
    private Instant deletedAt;

    /**
     * Coordinator who performed the deletion (audit)
     */
    private Long deletedBy;

    /**
     * Event id (UUID) used to deduplicate redeliveries
     */
    private String eventId;

    private Instant eventTimestamp;
}
