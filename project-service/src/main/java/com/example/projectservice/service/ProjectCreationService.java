package com.example.projectservice.service;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.model.ProjectAggregate;

/**
 * Multi-table project submission.
 */
public interface ProjectCreationService {

    /**
     * Create a project with its team members and external links.
     * Authorization: STUDENT only
     *
     * <p>Writes happen in the order project, team members, links. When a later write
     * fails the earlier rows are removed again before the error is raised.
     *
     * @param request submitted details
     * @param callerEmail verified e-mail of the submitting student
     * @param callerRole verified role of the caller
     * @return the hydrated project
     */
    ProjectAggregate createProject(ProjectDetailsRequest request, String callerEmail, UserRole callerRole);
}
