package com.example.projectservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Team membership row linking a student to a project.
 * Unique on (student_id, project_id); rows are written through an idempotent upsert.
 * The serial id records insertion order, which is the order students are listed in.
 */
@Entity
@Table(name = "team_member",
        uniqueConstraints = @UniqueConstraint(
                name = "team_member_unique_student_project",
                columnNames = {"student_id", "project_id"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;  // Logical reference to user (dangling ids are tolerated)
}
