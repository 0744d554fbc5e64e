package com.example.projectservice.service.impl;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.entity.Link;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.BadRequestException;
import com.example.projectservice.exception.ForbiddenException;
import com.example.projectservice.exception.PersistenceException;
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
import com.example.projectservice.service.ProjectCreationService;
import com.example.projectservice.service.ProjectHydrator;
import com.example.projectservice.service.UserResolver;
import com.example.projectservice.util.ProjectInputNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Implementation of ProjectCreationService.
 *
 * <p>Each store call commits on its own, so a submission is not atomic. Partial writes
 * are undone explicitly:
 * <ul>
 *   <li>team member insert fails: delete the project row</li>
 *   <li>link insert fails: delete team member rows (failure ignored), then the project row</li>
 * </ul>
 * The original store error is always the one raised.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectCreationServiceImpl implements ProjectCreationService {

    private static final String DEFAULT_STATUS = "Under Review";
    private static final String DEFAULT_SEMESTER = "Semester 1";

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
    public ProjectAggregate createProject(ProjectDetailsRequest request, String callerEmail, UserRole callerRole) {
        if (callerRole != UserRole.STUDENT) {
            throw ForbiddenException.roleNotAllowed("Only students can submit projects.", UserRole.STUDENT);
        }
        if (callerEmail == null || callerEmail.isBlank()) {
            throw UnauthorizedException.missingEmail();
        }

        User submitter = userResolver.findUserByEmail(callerEmail)
                .orElseThrow(ResourceNotFoundException::callerNotFound);

        String title = normalizer.normalizeString(request.getTitle());
        String description = normalizer.normalizeString(request.getDescription());
        if (title == null || description == null) {
            throw BadRequestException.validation("Both title and description are required.");
        }

        log.info("Creating project: submitterId={}, title={}", submitter.getId(), title);

        List<String> keywords = normalizer.normalizeStrings(request.getKeywords());
        List<String> externalLinks = normalizer.normalizeStrings(request.getExternalLinks());
        List<TeamMemberEntry> members = normalizer.ensureSubmitter(
                normalizer.normalizeTeamMembers(request.toTeamMemberEntries()),
                submitter.getId(), submitter.getName(), submitter.getEmail());

        User advisor = referenceResolver.resolveAdvisor(members);
        List<Long> studentIds = resolveStudentIds(submitter, members);
        if (studentIds.isEmpty()) {
            throw BadRequestException.noValidStudentMembers();
        }

        LocalDate today = normalizer.today();
        String completionDate = normalizer.normalizeString(request.getCompletionDate());
        LocalDate endDate = Optional.ofNullable(normalizer.parseDate(completionDate)).orElse(today);
        List<FileEntry> files = normalizer.normalizeFiles(request.toFileEntries());

        ProjectMetadata metadata = ProjectMetadata.builder()
                .keywords(keywords)
                .externalLinks(externalLinks)
                .teamMembers(members)
                .award(normalizer.normalizeString(request.getAward()))
                .courseCode(normalizer.normalizeString(request.getCourseCode()))
                .completionDate(completionDate)
                .files(files.isEmpty() ? null : files)
                .build();

        Project project = Project.builder()
                .name(title)
                .keyword(normalizer.resolveKeyword(keywords))
                .description(description)
                .projectType(normalizer.normalizeProjectType(request.getType()))
                .status(initialStatus(request.getStatus()))
                .semester(normalizer.normalizeSemester(
                        request.getSemester() != null ? request.getSemester() : DEFAULT_SEMESTER))
                .year(completionDate != null ? normalizer.yearOf(completionDate) : today.getYear())
                .teamName(normalizer.normalizeString(request.getTeamName()))
                .competitionName(normalizer.normalizeString(request.getCompetitionName()))
                .startDate(today)
                .endDate(endDate)
                .advisorId(advisor != null ? advisor.getId() : null)
                .courseId(referenceResolver.resolveCourseId(request.getCourseCode()))
                .commentStudent(metadataCodec.encode(metadata))
                .build();

        Project saved = storeCallHandler.handleStoreCall(() -> projectRepository.save(project), "insertProject");
        Long projectId = saved.getId();

        try {
            storeCallHandler.handleStoreCall(
                    () -> teamMemberRepository.upsertMembers(projectId, studentIds),
                    "upsertTeamMembers");
        } catch (PersistenceException e) {
            log.warn("Team member insert failed, removing project: projectId={}", projectId);
            deleteProjectAfterFailure(projectId);
            throw e;
        }

        try {
            insertLinks(projectId, externalLinks);
        } catch (PersistenceException e) {
            log.warn("Link insert failed, removing team members and project: projectId={}", projectId);
            try {
                storeCallHandler.handleStoreCall(
                        () -> teamMemberRepository.deleteAllByProjectId(projectId),
                        "deleteTeamMembers");
            } catch (PersistenceException cleanupError) {
                log.error("Ignoring team member cleanup failure: projectId={}", projectId, cleanupError);
            }
            deleteProjectAfterFailure(projectId);
            throw e;
        }

        log.info("Project created: projectId={}, students={}, advisorId={}, links={}",
                projectId, studentIds.size(), saved.getAdvisorId(), externalLinks.size());

        return projectHydrator.hydrateOne(projectId)
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(projectId));
    }

    /**
     * Submissions start as draft or under review; a submitter cannot approve or reject.
     */
    private ProjectStatus initialStatus(String requested) {
        ProjectStatus status = normalizer.normalizeStatus(requested != null ? requested : DEFAULT_STATUS);
        if (status == ProjectStatus.DRAFT || status == ProjectStatus.UNDERREVIEW) {
            return status;
        }
        log.info("Submitted status {} not allowed at creation, using {}",
                status.getValue(), ProjectStatus.UNDERREVIEW.getValue());
        return ProjectStatus.UNDERREVIEW;
    }

    /**
     * Submitter first, then the student entries in submitted order. Unknown e-mails are dropped.
     */
    private List<Long> resolveStudentIds(User submitter, List<TeamMemberEntry> members) {
        Set<String> emails = new LinkedHashSet<>();
        emails.add(submitter.getEmail().toLowerCase(Locale.ROOT));
        members.stream()
                .filter(TeamMemberEntry::isStudent)
                .map(member -> member.getEmail().toLowerCase(Locale.ROOT))
                .forEach(emails::add);

        Set<Long> studentIds = new LinkedHashSet<>();
        for (String email : emails) {
            Optional<User> student = email.equalsIgnoreCase(submitter.getEmail())
                    ? Optional.of(submitter)
                    : userResolver.findUserByEmail(email);
            if (student.isPresent()) {
                studentIds.add(student.get().getId());
            } else {
                log.debug("Dropping team member without account");
            }
        }
        return new ArrayList<>(studentIds);
    }

    private void insertLinks(Long projectId, List<String> externalLinks) {
        if (externalLinks.isEmpty()) {
            return;
        }
        List<Link> links = externalLinks.stream()
                .map(url -> Link.builder().projectId(projectId).link(url).build())
                .toList();
        storeCallHandler.handleStoreCall(() -> linkRepository.saveAll(links), "insertLinks");
    }

    private void deleteProjectAfterFailure(Long projectId) {
        try {
            storeCallHandler.runStoreCall(() -> projectRepository.deleteById(projectId), "deleteProject");
        } catch (PersistenceException cleanupError) {
            log.error("Failed to remove project after partial submission: projectId={}",
                    projectId, cleanupError);
        }
    }
}
