package com.example.projectservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Project row.
 *
 * CRITICAL:
 * - advisorId and courseId are logical references (NO JPA association, no cascade).
 *   Deleting a user only nulls advisorId, see UserDeletedEventConsumer.
 * - status, grade and feedback have no public setters; they change only through
 *   the workflow service (ProjectWorkflowServiceImpl).
 * - commentStudent holds the JSON metadata bag (see ProjectMetadataCodec).
 */
@Entity
@Table(name = "project")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "keyword", nullable = false, length = 20)
    private String keyword;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = EnumColumnConverters.ProjectTypeConverter.class)
    @Column(name = "project_type", nullable = false, length = 20)
    private ProjectType projectType;

    @Setter(AccessLevel.NONE)
    @Convert(converter = EnumColumnConverters.ProjectStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private ProjectStatus status;

    @Convert(converter = EnumColumnConverters.SemesterConverter.class)
    @Column(name = "semester", nullable = false, length = 1)
    private Semester semester;

    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "team_name")
    private String teamName;

    @Column(name = "competition_name")
    private String competitionName;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "advisor_id")
    private Long advisorId;  // Logical reference to user (NO FK cascade)

    @Column(name = "course_id")
    private Long courseId;   // Logical reference to course

    @Setter(AccessLevel.NONE)
    @Column(name = "grade", length = 2)
    private String grade;

    @Setter(AccessLevel.NONE)
    @Column(name = "feedback_advisor", columnDefinition = "TEXT")
    private String feedbackAdvisor;

    @Setter(AccessLevel.NONE)
    @Column(name = "feedback_coordinator", columnDefinition = "TEXT")
    private String feedbackCoordinator;

    /**
     * Metadata bag, opaque JSON text at rest.
     */
    @Column(name = "comment_student", columnDefinition = "TEXT")
    private String commentStudent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @ColumnDefault("0")
    @Column(name = "version", nullable = false)
    private Integer version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = ProjectStatus.DRAFT;
        }
    }

    public void transitionTo(ProjectStatus target) {
        this.status = target;
    }

    /**
     * Grade lives in the metadata bag; the grade column is always cleared.
     */
    public void recordGrade(String encodedMetadata) {
        this.commentStudent = encodedMetadata;
        this.grade = null;
    }

    public void recordAdvisorFeedback(String feedback) {
        this.feedbackAdvisor = feedback;
    }

    public void recordCoordinatorFeedback(String feedback) {
        this.feedbackCoordinator = feedback;
    }
}
