package com.example.projectservice.controller;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.dto.request.UpdateFeedbackRequest;
import com.example.projectservice.dto.request.UpdateGradeRequest;
import com.example.projectservice.dto.request.UpdateStatusRequest;
import com.example.projectservice.dto.response.ProjectResponse;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.UnauthorizedException;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.security.CurrentUser;
import com.example.projectservice.service.ProjectCreationService;
import com.example.projectservice.service.ProjectQueryService;
import com.example.projectservice.service.ProjectWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for projects.
 *
 * Authorization (single-role routes are gated in SecurityConfig, role rules that
 * depend on the project are enforced by the services):
 * - POST /api/projects: STUDENT
 * - GET /api/projects: AUTHENTICATED, scoped by role
 * - GET /api/projects/archive: AUTHENTICATED
 * - GET /api/projects/{projectId}: AUTHENTICATED
 * - GET /api/projects/course/{courseId}: COORDINATOR
 * - PATCH /api/projects/{projectId}: team member STUDENT or COORDINATOR
 * - PATCH /api/projects/{projectId}/grade: assigned ADVISOR
 * - PATCH /api/projects/{projectId}/feedback: assigned ADVISOR or COORDINATOR
 * - PATCH /api/projects/{projectId}/status: assigned ADVISOR or COORDINATOR
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectController {

    private final ProjectCreationService creationService;
    private final ProjectWorkflowService workflowService;
    private final ProjectQueryService queryService;

    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> createProject(
            @Valid @RequestBody ProjectDetailsRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ProjectAggregate created = creationService.createProject(
                request, currentUser.getEmail(), roleOf(currentUser));
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(created));
    }

    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<ProjectResponse>> listProjects(
            @AuthenticationPrincipal CurrentUser currentUser) {

        return ResponseEntity.ok(toResponses(
                queryService.listProjectsForCaller(currentUser.getEmail(), roleOf(currentUser))));
    }

    /**
     * Approved projects
     */
    @GetMapping("/archive")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<ProjectResponse>> listArchive() {
        return ResponseEntity.ok(toResponses(queryService.listArchive()));
    }

    @GetMapping("/course/{courseId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<ProjectResponse>> listByCourse(@PathVariable Long courseId) {
        return ResponseEntity.ok(toResponses(queryService.listProjectsByCourse(courseId)));
    }

    @GetMapping("/{projectId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable Long projectId) {
        return ResponseEntity.ok(ProjectResponse.from(queryService.getProject(projectId)));
    }

    @PatchMapping("/{projectId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> updateProject(
            @PathVariable Long projectId,
            @Valid @RequestBody ProjectDetailsRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ProjectAggregate updated = workflowService.updateProject(
                projectId, request, currentUser.getEmail(), roleOf(currentUser));
        return ResponseEntity.ok(ProjectResponse.from(updated));
    }

    @PatchMapping("/{projectId}/grade")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> updateGrade(
            @PathVariable Long projectId,
            @RequestBody UpdateGradeRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ProjectAggregate updated = workflowService.updateGrade(
                projectId, request.getGrade(), currentUser.getEmail(), roleOf(currentUser));
        return ResponseEntity.ok(ProjectResponse.from(updated));
    }

    @PatchMapping("/{projectId}/feedback")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> updateFeedback(
            @PathVariable Long projectId,
            @Valid @RequestBody UpdateFeedbackRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ProjectAggregate updated = workflowService.updateFeedback(
                projectId, request.getFeedback(), currentUser.getEmail(), roleOf(currentUser));
        return ResponseEntity.ok(ProjectResponse.from(updated));
    }

    @PatchMapping("/{projectId}/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ProjectResponse> updateStatus(
            @PathVariable Long projectId,
            @Valid @RequestBody UpdateStatusRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        ProjectAggregate updated = workflowService.updateStatus(
                projectId, request.getStatus(), currentUser.getEmail(), roleOf(currentUser));
        return ResponseEntity.ok(ProjectResponse.from(updated));
    }

    private static UserRole roleOf(CurrentUser currentUser) {
        return currentUser.getRole().orElseThrow(UnauthorizedException::missingRole);
    }

    private static List<ProjectResponse> toResponses(List<ProjectAggregate> aggregates) {
        return aggregates.stream().map(ProjectResponse::from).toList();
    }
}
