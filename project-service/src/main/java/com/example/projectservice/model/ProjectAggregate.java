package com.example.projectservice.model;

import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.User;
import com.example.projectservice.metadata.ProjectMetadata;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Read-only view of a project with its related rows resolved.
 * Built by {@link com.example.projectservice.service.ProjectHydrator} on every read, never persisted.
 */
@Getter
@Builder
public class ProjectAggregate {

    private final Project project;

    /**
     * Null when the project has no advisor or the advisor no longer exists.
     */
    private final User advisor;

    /**
     * In team_member insertion order; dangling student ids are left out.
     */
    @Singular
    private final List<User> students;

    /**
     * Null when the stored bag is absent or unreadable.
     */
    private final ProjectMetadata metadata;

    @Singular
    private final List<String> links;

    public Long getId() {
        return project.getId();
    }

    /**
     * Grade from the metadata bag, falling back to the grade column.
     */
    public String getEffectiveGrade() {
        if (metadata != null && metadata.getGrade() != null) {
            return metadata.getGrade();
        }
        return project.getGrade();
    }

    /**
     * Grade currently held in the metadata bag; the value compared for no-op grade writes.
     */
    public String getMetadataGrade() {
        return metadata == null ? null : metadata.getGrade();
    }
}
