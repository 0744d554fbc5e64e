package com.example.projectservice.service;

import com.example.projectservice.entity.UserRole;
import com.example.projectservice.model.ProjectAggregate;

import java.util.List;

/**
 * Read side; all results are hydrated and ordered by project id.
 */
public interface ProjectQueryService {

    ProjectAggregate getProject(Long projectId);

    /**
     * Students see the projects they belong to, advisors the projects they advise,
     * coordinators every project.
     */
    List<ProjectAggregate> listProjectsForCaller(String callerEmail, UserRole callerRole);

    /**
     * Approved projects, visible to every role.
     */
    List<ProjectAggregate> listArchive();

    List<ProjectAggregate> listProjectsByCourse(Long courseId);
}
