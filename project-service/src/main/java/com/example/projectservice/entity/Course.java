package com.example.projectservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the course table, used to resolve a course code to its id.
 */
@Entity
@Immutable
@Table(name = "course")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class Course {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "course_code", nullable = false)
    private String courseCode;
}
