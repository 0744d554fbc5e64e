package com.example.projectservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the user table.
 * Accounts are managed elsewhere; this service only resolves them.
 * Email is unique and compared case-insensitively.
 */
@Entity
@Immutable
@Table(name = "\"user\"")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Convert(converter = EnumColumnConverters.UserRoleConverter.class)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;
}
