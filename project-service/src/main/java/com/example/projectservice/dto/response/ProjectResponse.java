package com.example.projectservice.dto.response;

import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.User;
import com.example.projectservice.metadata.FileEntry;
import com.example.projectservice.metadata.ProjectMetadata;
import com.example.projectservice.metadata.TeamMemberEntry;
import com.example.projectservice.model.ProjectAggregate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Project as shown to clients: display labels instead of column values,
 * related users flattened to names and e-mails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectResponse {

    private Long id;
    private String title;
    private String type;
    private String status;
    private LocalDate submissionDate;
    private LocalDate lastModified;
    private String description;
    private List<String> students;
    private List<StudentDetail> studentDetails;
    private String advisor;
    private String advisorEmail;
    private String teamName;
    private List<String> keywords;
    private String competitionName;
    private String award;
    private List<String> externalLinks;
    private List<FileEntry> files;
    private List<TeamMemberEntry> teamMembers;
    private String semester;
    private String year;
    private Long courseId;
    private String courseCode;
    private String completionDate;
    private String grade;
    private Feedback feedback;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StudentDetail {
        private Long id;
        private String name;
        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Feedback {
        private String advisor;
        private String coordinator;
    }

    public static ProjectResponse from(ProjectAggregate aggregate) {
        Project project = aggregate.getProject();
        User advisor = aggregate.getAdvisor();
        ProjectMetadata metadata = aggregate.getMetadata() != null
                ? aggregate.getMetadata()
                : new ProjectMetadata();

        String completionDate = metadata.getCompletionDate() != null
                ? metadata.getCompletionDate()
                : (project.getEndDate() != null ? project.getEndDate().toString() : null);

        return ProjectResponse.builder()
                .id(project.getId())
                .title(project.getName())
                .type(project.getProjectType() != null ? project.getProjectType().getDisplayName() : "Other")
                .status(project.getStatus() != null ? project.getStatus().getDisplayName() : "Under Review")
                .submissionDate(project.getStartDate())
                .lastModified(project.getEndDate())
                .description(project.getDescription() != null ? project.getDescription() : "")
                .students(aggregate.getStudents().stream().map(User::getName).toList())
                .studentDetails(aggregate.getStudents().stream()
                        .map(student -> StudentDetail.builder()
                                .id(student.getId())
                                .name(student.getName())
                                .email(student.getEmail())
                                .build())
                        .toList())
                .advisor(advisor != null ? advisor.getName() : "")
                .advisorEmail(advisor != null ? advisor.getEmail() : "")
                .teamName(project.getTeamName() != null ? project.getTeamName() : "")
                .keywords(metadata.getKeywords() != null ? metadata.getKeywords() : List.of())
                .competitionName(project.getCompetitionName())
                .award(metadata.getAward())
                .externalLinks(metadata.getExternalLinks() != null ? metadata.getExternalLinks() : aggregate.getLinks())
                .files(metadata.getFiles() != null ? metadata.getFiles() : List.of())
                .teamMembers(metadata.getTeamMembers() != null ? metadata.getTeamMembers() : List.of())
                .semester(project.getSemester() != null ? project.getSemester().getLabel() : "Semester 1")
                .year(project.getYear() != null ? project.getYear().toString() : "")
                .courseId(project.getCourseId())
                .courseCode(metadata.getCourseCode())
                .completionDate(completionDate)
                .grade(aggregate.getEffectiveGrade())
                .feedback(Feedback.builder()
                        .advisor(project.getFeedbackAdvisor())
                        .coordinator(project.getFeedbackCoordinator())
                        .build())
                .build();
    }
}
