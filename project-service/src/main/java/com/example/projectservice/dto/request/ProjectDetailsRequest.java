package com.example.projectservice.dto.request;

import com.example.projectservice.metadata.FileEntry;
import com.example.projectservice.metadata.TeamMemberEntry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Objects;

/**
 * Request body for submitting a project and for editing its details.
 * Free-text values (type, status, semester) are normalized server-side, never rejected.
 * On update, absent scalar fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectDetailsRequest {

    @Size(max = 255, message = "Title must not exceed 255 characters")
    private String title;

    private String description;

    private String type;

    private List<String> keywords;

    @Size(max = 255, message = "Team name must not exceed 255 characters")
    private String teamName;

    private String status;

    private String semester;

    private String competitionName;

    private String award;

    private List<String> externalLinks;

    @Valid
    private List<TeamMemberRequest> teamMembers;

    private String courseCode;

    /**
     * ISO date, e.g. 2025-05-30.
     */
    private String completionDate;

    @Valid
    private List<FileRequest> files;

    public List<TeamMemberEntry> toTeamMemberEntries() {
        if (teamMembers == null) {
            return List.of();
        }
        return teamMembers.stream()
                .filter(Objects::nonNull)
                .map(TeamMemberRequest::toEntry)
                .toList();
    }

    public List<FileEntry> toFileEntries() {
        if (files == null) {
            return List.of();
        }
        return files.stream()
                .filter(Objects::nonNull)
                .map(FileRequest::toEntry)
                .toList();
    }
}
