package com.example.projectservice.service.impl;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.entity.Link;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.BadRequestException;
import com.example.projectservice.exception.ConflictException;
import com.example.projectservice.exception.ForbiddenException;
import com.example.projectservice.exception.ResourceNotFoundException;
import com.example.projectservice.exception.UnauthorizedException;
import com.example.projectservice.metadata.FileEntry;
import com.example.projectservice.metadata.ProjectMetadata;
import com.example.projectservice.metadata.ProjectMetadataCodec;
import com.example.projectservice.metadata.TeamMemberEntry;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.repository.LinkRepository;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.TeamMemberRepository;
import com.example.projectservice.service.ProjectHydrator;
import com.example.projectservice.service.ProjectWorkflowService;
import com.example.projectservice.service.UserResolver;
import com.example.projectservice.util.ProjectInputNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Implementation of ProjectWorkflowService.
 *
 * Status, grade and feedback are only ever changed here. A concurrent write to the same
 * project is detected through the project version and reported as a conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectWorkflowServiceImpl implements ProjectWorkflowService {

    private final ProjectRepository projectRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final LinkRepository linkRepository;
    private final UserResolver userResolver;
    private final ProjectReferenceResolver referenceResolver;
    private final ProjectHydrator projectHydrator;
    private final ProjectMetadataCodec metadataCodec;
    private final ProjectInputNormalizer normalizer;
    private final StoreCallHandler storeCallHandler;

    @Override
    public ProjectAggregate updateProject(Long projectId, ProjectDetailsRequest request,
                                          String callerEmail, UserRole callerRole) {
        if (callerRole == UserRole.ADVISOR) {
            throw ForbiddenException.advisorCannotEditProject();
        }
        if (callerRole != UserRole.STUDENT && callerRole != UserRole.COORDINATOR) {
            throw ForbiddenException.roleNotAllowed(UserRole.STUDENT, UserRole.COORDINATOR);
        }

        User caller = resolveCaller(callerEmail);
        ProjectAggregate current = loadProject(projectId);

        if (callerRole == UserRole.STUDENT) {
            boolean member = storeCallHandler.handleStoreCall(
                    () -> teamMemberRepository.existsByProjectIdAndStudentId(projectId, caller.getId()),
                    "checkTeamMembership");
            if (!member) {
                throw ForbiddenException.notProjectMember();
            }
        }

        log.info("Updating project: projectId={}, callerId={}, role={}", projectId, caller.getId(), callerRole);

        List<String> keywords = normalizer.normalizeStrings(request.getKeywords());
        List<String> externalLinks = normalizer.normalizeStrings(request.getExternalLinks());
        List<TeamMemberEntry> members = normalizer.normalizeTeamMembers(request.toTeamMemberEntries());
        List<FileEntry> files = normalizer.normalizeFiles(request.toFileEntries());
        String completionDate = normalizer.normalizeString(request.getCompletionDate());
        User advisor = referenceResolver.resolveAdvisor(members);

        // Submitted keys replace stored ones; keys the form does not know (grade, extras) survive
        ProjectMetadata merged = copyOf(current.getMetadata()).toBuilder()
                .keywords(keywords)
                .externalLinks(externalLinks)
                .teamMembers(members)
                .award(normalizer.normalizeString(request.getAward()))
                .courseCode(normalizer.normalizeString(request.getCourseCode()))
                .completionDate(completionDate)
                .files(files.isEmpty() ? null : files)
                .build();

        Project project = current.getProject();
        String title = normalizer.normalizeString(request.getTitle());
        if (title != null) {
            project.setName(title);
        }
        String description = normalizer.normalizeString(request.getDescription());
        if (description != null) {
            project.setDescription(description);
        }
        if (normalizer.normalizeString(request.getType()) != null) {
            project.setProjectType(normalizer.normalizeProjectType(request.getType()));
        }
        String teamName = normalizer.normalizeString(request.getTeamName());
        if (teamName != null) {
            project.setTeamName(teamName);
        }
        if (normalizer.normalizeString(request.getSemester()) != null) {
            project.setSemester(normalizer.normalizeSemester(request.getSemester()));
        }
        String competitionName = normalizer.normalizeString(request.getCompetitionName());
        if (competitionName != null) {
            project.setCompetitionName(competitionName);
        }
        LocalDate endDate = normalizer.parseDate(completionDate);
        if (endDate != null) {
            project.setEndDate(endDate);
        }
        Long courseId = referenceResolver.resolveCourseId(request.getCourseCode());
        if (courseId != null) {
            project.setCourseId(courseId);
        }
        applyRequestedStatus(project, request.getStatus(), callerRole);
        project.setAdvisorId(advisor != null ? advisor.getId() : null);
        project.setCommentStudent(metadataCodec.encode(merged));

        saveProject(project, "updateProject");
        replaceLinks(projectId, externalLinks);

        return reload(projectId);
    }

    @Override
    public ProjectAggregate updateGrade(Long projectId, String grade, String callerEmail, UserRole callerRole) {
        if (callerRole != UserRole.ADVISOR) {
            throw ForbiddenException.roleNotAllowed("Only advisors can update grades.", UserRole.ADVISOR);
        }
        String normalizedGrade = normalizer.normalizeGrade(grade);

        User caller = resolveCaller(callerEmail);
        ProjectAggregate current = loadProject(projectId);
        requireAssignedAdvisor(current, caller);

        if (Objects.equals(current.getMetadataGrade(), normalizedGrade)) {
            log.debug("Grade unchanged, skipping write: projectId={}", projectId);
            return current;
        }

        ProjectMetadata metadata = copyOf(current.getMetadata());
        metadata.setGrade(normalizedGrade);

        Project project = current.getProject();
        project.recordGrade(metadataCodec.encode(metadata));
        saveProject(project, "updateProjectGrade");

        log.info("Grade updated: projectId={}, advisorId={}, grade={}", projectId, caller.getId(), normalizedGrade);
        return reload(projectId);
    }

    @Override
    public ProjectAggregate updateFeedback(Long projectId, String feedback, String callerEmail, UserRole callerRole) {
        if (callerRole != UserRole.ADVISOR && callerRole != UserRole.COORDINATOR) {
            throw ForbiddenException.roleNotAllowed(
                    "Only advisors or coordinators can update feedback.", UserRole.ADVISOR, UserRole.COORDINATOR);
        }
        String text = normalizer.normalizeString(feedback);
        if (text == null) {
            throw BadRequestException.validation("Feedback text is required.");
        }

        User caller = resolveCaller(callerEmail);
        ProjectAggregate current = loadProject(projectId);
        if (callerRole == UserRole.ADVISOR) {
            requireAssignedAdvisor(current, caller);
        }

        Project project = current.getProject();
        if (callerRole == UserRole.ADVISOR) {
            project.recordAdvisorFeedback(text);
        } else {
            project.recordCoordinatorFeedback(text);
        }
        saveProject(project, "updateProjectFeedback");

        log.info("Feedback updated: projectId={}, callerId={}, role={}", projectId, caller.getId(), callerRole);
        return reload(projectId);
    }

    @Override
    public ProjectAggregate updateStatus(Long projectId, String status, String callerEmail, UserRole callerRole) {
        if (callerRole != UserRole.ADVISOR && callerRole != UserRole.COORDINATOR) {
            throw ForbiddenException.roleNotAllowed(
                    "Only advisors or coordinators can update project status.", UserRole.ADVISOR, UserRole.COORDINATOR);
        }
        if (normalizer.normalizeString(status) == null) {
            throw BadRequestException.validation("Status value is required.");
        }
        ProjectStatus target = normalizer.normalizeStatus(status);

        User caller = resolveCaller(callerEmail);
        ProjectAggregate current = loadProject(projectId);
        if (callerRole == UserRole.ADVISOR) {
            requireAssignedAdvisor(current, caller);
        }

        Project project = current.getProject();
        if (project.getStatus() == target) {
            log.debug("Status unchanged, skipping write: projectId={}, status={}", projectId, target.getValue());
            return current;
        }
        if (!project.getStatus().canTransitionTo(target)) {
            throw ConflictException.invalidTransition(project.getStatus(), target);
        }

        ProjectStatus previous = project.getStatus();
        project.transitionTo(target);
        saveProject(project, "updateProjectStatus");

        log.info("Status updated: projectId={}, from={}, to={}, callerId={}",
                projectId, previous.getValue(), target.getValue(), caller.getId());
        return reload(projectId);
    }

    // ==================== Helper Methods ====================

    /**
     * Only coordinators change status through a details edit; students cannot approve their own work.
     */
    private void applyRequestedStatus(Project project, String requestedStatus, UserRole callerRole) {
        if (normalizer.normalizeString(requestedStatus) == null) {
            return;
        }
        if (callerRole != UserRole.COORDINATOR) {
            log.debug("Ignoring status in details edit from role {}", callerRole);
            return;
        }
        ProjectStatus target = normalizer.normalizeStatus(requestedStatus);
        if (project.getStatus() == target) {
            return;
        }
        if (!project.getStatus().canTransitionTo(target)) {
            throw ConflictException.invalidTransition(project.getStatus(), target);
        }
        project.transitionTo(target);
    }

    private void replaceLinks(Long projectId, List<String> externalLinks) {
        storeCallHandler.handleStoreCall(() -> linkRepository.deleteAllByProjectId(projectId), "deleteLinks");
        if (externalLinks.isEmpty()) {
            return;
        }
        List<Link> links = externalLinks.stream()
                .map(url -> Link.builder().projectId(projectId).link(url).build())
                .toList();
        storeCallHandler.handleStoreCall(() -> linkRepository.saveAll(links), "insertLinks");
    }

    private void saveProject(Project project, String operationName) {
        try {
            storeCallHandler.handleStoreCall(() -> projectRepository.save(project), operationName);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent modification detected: projectId={}, operation={}", project.getId(), operationName);
            throw ConflictException.concurrentModification(e);
        }
    }

    private User resolveCaller(String callerEmail) {
        if (callerEmail == null || callerEmail.isBlank()) {
            throw UnauthorizedException.missingEmail();
        }
        return userResolver.findUserByEmail(callerEmail)
                .orElseThrow(ResourceNotFoundException::callerNotFound);
    }

    private ProjectAggregate loadProject(Long projectId) {
        return projectHydrator.hydrateOne(projectId)
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(projectId));
    }

    private ProjectAggregate reload(Long projectId) {
        return loadProject(projectId);
    }

    private static void requireAssignedAdvisor(ProjectAggregate aggregate, User caller) {
        if (!Objects.equals(aggregate.getProject().getAdvisorId(), caller.getId())) {
            throw ForbiddenException.advisorNotAssigned();
        }
    }

    private static ProjectMetadata copyOf(ProjectMetadata metadata) {
        if (metadata == null) {
            return new ProjectMetadata();
        }
        return metadata.toBuilder()
                .additional(new TreeMap<>(metadata.getAdditional() != null ? metadata.getAdditional() : new TreeMap<>()))
                .build();
    }
}
