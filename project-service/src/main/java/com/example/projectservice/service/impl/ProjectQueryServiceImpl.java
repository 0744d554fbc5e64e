package com.example.projectservice.service.impl;

import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.TeamMember;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.ForbiddenException;
import com.example.projectservice.exception.ResourceNotFoundException;
import com.example.projectservice.exception.UnauthorizedException;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.TeamMemberRepository;
import com.example.projectservice.service.ProjectHydrator;
import com.example.projectservice.service.ProjectQueryService;
import com.example.projectservice.service.UserResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Implementation of ProjectQueryService.
 * Base rows come from single-table queries; relations are added by ProjectHydrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectQueryServiceImpl implements ProjectQueryService {

    private final ProjectRepository projectRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final UserResolver userResolver;
    private final ProjectHydrator projectHydrator;
    private final StoreCallHandler storeCallHandler;

    @Override
    public ProjectAggregate getProject(Long projectId) {
        log.debug("Getting project: projectId={}", projectId);
        return projectHydrator.hydrateOne(projectId)
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(projectId));
    }

    @Override
    public List<ProjectAggregate> listProjectsForCaller(String callerEmail, UserRole callerRole) {
        if (callerRole == UserRole.COORDINATOR) {
            return projectHydrator.hydrate(storeCallHandler.handleStoreCall(
                    projectRepository::findAllByOrderByIdAsc, "selectAllProjects"));
        }
        if (callerRole != UserRole.STUDENT && callerRole != UserRole.ADVISOR) {
            throw ForbiddenException.roleNotAllowed(UserRole.STUDENT, UserRole.ADVISOR, UserRole.COORDINATOR);
        }
        if (callerEmail == null || callerEmail.isBlank()) {
            throw UnauthorizedException.missingEmail();
        }

        User caller = userResolver.findUserByEmail(callerEmail)
                .orElseThrow(ResourceNotFoundException::callerNotFound);

        if (callerRole == UserRole.ADVISOR) {
            List<Project> advised = storeCallHandler.handleStoreCall(
                    () -> projectRepository.findAllByAdvisorIdOrderByIdAsc(caller.getId()),
                    "selectProjectsByAdvisor");
            return projectHydrator.hydrate(advised);
        }

        List<Long> projectIds = storeCallHandler.handleStoreCall(
                        () -> teamMemberRepository.findAllByStudentIdOrderByIdAsc(caller.getId()),
                        "selectMembershipsByStudent")
                .stream()
                .map(TeamMember::getProjectId)
                .distinct()
                .toList();
        log.debug("Listing student projects: studentId={}, memberships={}", caller.getId(), projectIds.size());
        return projectHydrator.hydrateByIds(projectIds);
    }

    @Override
    public List<ProjectAggregate> listArchive() {
        return projectHydrator.hydrate(storeCallHandler.handleStoreCall(
                () -> projectRepository.findAllByStatusOrderByIdAsc(ProjectStatus.APPROVED),
                "selectApprovedProjects"));
    }

    @Override
    public List<ProjectAggregate> listProjectsByCourse(Long courseId) {
        return projectHydrator.hydrate(storeCallHandler.handleStoreCall(
                () -> projectRepository.findAllByCourseIdOrderByIdAsc(courseId),
                "selectProjectsByCourse"));
    }
}
