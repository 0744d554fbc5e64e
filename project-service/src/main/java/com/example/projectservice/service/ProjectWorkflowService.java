package com.example.projectservice.service;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.model.ProjectAggregate;

/**
 * Role-gated mutations of an existing project.
 * Every method returns the project re-hydrated after the write.
 */
public interface ProjectWorkflowService {

    /**
     * Edit project details, team snapshot and external links.
     * Authorization: STUDENT (team member) or COORDINATOR; never ADVISOR
     */
    ProjectAggregate updateProject(Long projectId, ProjectDetailsRequest request,
                                   String callerEmail, UserRole callerRole);

    /**
     * Assign or clear the grade.
     * Authorization: the ADVISOR assigned to the project
     *
     * @param grade letter grade, null or blank to clear
     */
    ProjectAggregate updateGrade(Long projectId, String grade, String callerEmail, UserRole callerRole);

    /**
     * Set the feedback field matching the caller's role.
     * Authorization: assigned ADVISOR or any COORDINATOR
     */
    ProjectAggregate updateFeedback(Long projectId, String feedback, String callerEmail, UserRole callerRole);

    /**
     * Move the project to a new review status.
     * Authorization: assigned ADVISOR or any COORDINATOR
     *
     * @param status free text, normalized (unknown text means under review)
     */
    ProjectAggregate updateStatus(Long projectId, String status, String callerEmail, UserRole callerRole);
}
