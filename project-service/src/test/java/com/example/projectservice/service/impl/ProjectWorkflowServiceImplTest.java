package com.example.projectservice.service.impl;

import com.example.projectservice.dto.request.ProjectDetailsRequest;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.BadRequestException;
import com.example.projectservice.exception.ConflictException;
import com.example.projectservice.exception.ForbiddenException;
import com.example.projectservice.metadata.ProjectMetadata;
import com.example.projectservice.metadata.ProjectMetadataCodec;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.repository.CourseRepository;
import com.example.projectservice.repository.LinkRepository;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.TeamMemberRepository;
import com.example.projectservice.service.ProjectHydrator;
import com.example.projectservice.service.UserResolver;
import com.example.projectservice.util.ProjectInputNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectWorkflowServiceImplTest {

    private static final Long PROJECT_ID = 5L;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TeamMemberRepository teamMemberRepository;

    @Mock
    private LinkRepository linkRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private UserResolver userResolver;

    @Mock
    private ProjectHydrator projectHydrator;

    private final ProjectMetadataCodec codec = new ProjectMetadataCodec(new ObjectMapper());

    private ProjectWorkflowServiceImpl service;

    private final User advisor = User.builder().id(10L).name("Lee").email("lee@x.edu").role(UserRole.ADVISOR).build();
    private final User otherAdvisor = User.builder().id(11L).name("Kim").email("kim@x.edu").role(UserRole.ADVISOR).build();
    private final User coordinator = User.builder().id(30L).name("Dean").email("dean@x.edu").role(UserRole.COORDINATOR).build();
    private final User student = User.builder().id(1L).name("Ann").email("ann@x.edu").role(UserRole.STUDENT).build();

    @BeforeEach
    void setUp() {
        ProjectInputNormalizer normalizer = new ProjectInputNormalizer();
        StoreCallHandler storeCallHandler = new StoreCallHandler();
        ProjectReferenceResolver referenceResolver =
                new ProjectReferenceResolver(userResolver, courseRepository, storeCallHandler, normalizer);
        service = new ProjectWorkflowServiceImpl(projectRepository, teamMemberRepository, linkRepository,
                userResolver, referenceResolver, projectHydrator, codec, normalizer, storeCallHandler);
    }

    // ==================== Grade ====================

    @Test
    void unchangedGradeIsNotWritten() {
        ProjectAggregate current = aggregate(project(ProjectStatus.UNDERREVIEW, "{\"grade\":\"A\"}"));
        when(userResolver.findUserByEmail("lee@x.edu")).thenReturn(Optional.of(advisor));
        when(projectHydrator.hydrateOne(PROJECT_ID)).thenReturn(Optional.of(current));

        ProjectAggregate result = service.updateGrade(PROJECT_ID, " a ", "lee@x.edu", UserRole.ADVISOR);

        assertThat(result).isSameAs(current);
        verify(projectRepository, never()).save(any());
    }

    @Test
    void gradeIsStoredInMetadataAndColumnIsCleared() {
        Project project = Project.builder()
                .id(PROJECT_ID)
                .status(ProjectStatus.UNDERREVIEW)
                .advisorId(10L)
                .grade("B")
                .commentStudent("{\"keywords\":[\"ai\"],\"rubric\":{\"score\":7}}")
                .build();
        when(userResolver.findUserByEmail("lee@x.edu")).thenReturn(Optional.of(advisor));
        when(projectHydrator.hydrateOne(PROJECT_ID)).thenReturn(Optional.of(aggregate(project)));
        when(projectRepository.save(any(Project.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.updateGrade(PROJECT_ID, "b+", "lee@x.edu", UserRole.ADVISOR);

        Project saved = captureSavedProject();
        assertThat(saved.getGrade()).isNull();
        ProjectMetadata metadata = codec.decode(saved.getCommentStudent());
        assertThat(metadata.getGrade()).isEqualTo("B+");
        assertThat(metadata.getKeywords()).containsExactly("ai");
        assertThat(metadata.getAdditional()).containsKey("rubric");
    }

    @Test
    void unsupportedGradeIsRejectedBeforeAnyRead() {
        assertThatThrownBy(() -> service.updateGrade(PROJECT_ID, "Z", "lee@x.edu", UserRole.ADVISOR))
                .isInstanceOf(BadRequestException.class);

        verifyNoInteractions(userResolver, projectHydrator, projectRepository);
    }

    @Test
    void onlyAdvisorsGrade() {
        assertThatThrownBy(() -> service.updateGrade(PROJECT_ID, "A", "dean@x.edu", UserRole.COORDINATOR))
                .isInstanceOf(ForbiddenException.class)
                .extracting("requiredRoles")
                .isEqualTo(List.of(UserRole.ADVISOR));
    }

    @Test
    void unassignedAdvisorCannotGradeReviewOrChangeStatus() {
        when(userResolver.findUserByEmail("kim@x.edu")).thenReturn(Optional.of(otherAdvisor));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.UNDERREVIEW, null))));

        assertThatThrownBy(() -> service.updateGrade(PROJECT_ID, "A", "kim@x.edu", UserRole.ADVISOR))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You are not assigned as the advisor for this project.");
        assertThatThrownBy(() -> service.updateFeedback(PROJECT_ID, "Nice", "kim@x.edu", UserRole.ADVISOR))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> service.updateStatus(PROJECT_ID, "approved", "kim@x.edu", UserRole.ADVISOR))
                .isInstanceOf(ForbiddenException.class);

        verify(projectRepository, never()).save(any());
    }

    // ==================== Feedback ====================

    @Test
    void coordinatorFeedbackGoesToCoordinatorColumn() {
        Project project = project(ProjectStatus.UNDERREVIEW, null);
        when(userResolver.findUserByEmail("dean@x.edu")).thenReturn(Optional.of(coordinator));
        when(projectHydrator.hydrateOne(PROJECT_ID)).thenReturn(Optional.of(aggregate(project)));
        when(projectRepository.save(any(Project.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.updateFeedback(PROJECT_ID, "  Well scoped.  ", "dean@x.edu", UserRole.COORDINATOR);

        Project saved = captureSavedProject();
        assertThat(saved.getFeedbackCoordinator()).isEqualTo("Well scoped.");
        assertThat(saved.getFeedbackAdvisor()).isNull();
    }

    @Test
    void blankFeedbackIsRejected() {
        assertThatThrownBy(() -> service.updateFeedback(PROJECT_ID, "   ", "lee@x.edu", UserRole.ADVISOR))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Feedback text is required.");
    }

    // ==================== Status ====================

    @Test
    void statusTextIsNormalizedBeforeTransition() {
        when(userResolver.findUserByEmail("lee@x.edu")).thenReturn(Optional.of(advisor));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.UNDERREVIEW, null))));
        when(projectRepository.save(any(Project.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.updateStatus(PROJECT_ID, "Completed", "lee@x.edu", UserRole.ADVISOR);

        assertThat(captureSavedProject().getStatus()).isEqualTo(ProjectStatus.APPROVED);
    }

    @Test
    void sameStatusIsNotWritten() {
        ProjectAggregate current = aggregate(project(ProjectStatus.REJECT, null));
        when(userResolver.findUserByEmail("dean@x.edu")).thenReturn(Optional.of(coordinator));
        when(projectHydrator.hydrateOne(PROJECT_ID)).thenReturn(Optional.of(current));

        assertThat(service.updateStatus(PROJECT_ID, "deny", "dean@x.edu", UserRole.COORDINATOR)).isSameAs(current);
        verify(projectRepository, never()).save(any());
    }

    @Test
    void approvingADraftIsAConflict() {
        when(userResolver.findUserByEmail("dean@x.edu")).thenReturn(Optional.of(coordinator));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.DRAFT, null))));

        assertThatThrownBy(() -> service.updateStatus(PROJECT_ID, "approved", "dean@x.edu", UserRole.COORDINATOR))
                .isInstanceOf(ConflictException.class)
                .extracting("code")
                .isEqualTo("INVALID_STATUS_TRANSITION");
        verify(projectRepository, never()).save(any());
    }

    @Test
    void concurrentWriteIsReportedAsConflict() {
        when(userResolver.findUserByEmail("lee@x.edu")).thenReturn(Optional.of(advisor));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.UNDERREVIEW, null))));
        when(projectRepository.save(any(Project.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(Project.class, PROJECT_ID));

        assertThatThrownBy(() -> service.updateStatus(PROJECT_ID, "approved", "lee@x.edu", UserRole.ADVISOR))
                .isInstanceOf(ConflictException.class)
                .extracting("code")
                .isEqualTo("CONCURRENT_MODIFICATION");
    }

    // ==================== Details ====================

    @Test
    void advisorsCannotEditDetails() {
        assertThatThrownBy(() -> service.updateProject(PROJECT_ID, new ProjectDetailsRequest(),
                "lee@x.edu", UserRole.ADVISOR))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Advisors cannot update project details.")
                .extracting("requiredRoles")
                .isEqualTo(List.of(UserRole.STUDENT, UserRole.COORDINATOR));

        verifyNoInteractions(projectHydrator, projectRepository);
    }

    @Test
    void studentOutsideTheTeamCannotEditDetails() {
        when(userResolver.findUserByEmail("ann@x.edu")).thenReturn(Optional.of(student));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.UNDERREVIEW, null))));
        when(teamMemberRepository.existsByProjectIdAndStudentId(PROJECT_ID, 1L)).thenReturn(false);

        assertThatThrownBy(() -> service.updateProject(PROJECT_ID, new ProjectDetailsRequest(),
                "ann@x.edu", UserRole.STUDENT))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("You are not a member of this project.");
        verify(projectRepository, never()).save(any());
    }

    @Test
    void memberEditReplacesLinksAndKeepsGradeAndStatus() {
        Project project = project(ProjectStatus.UNDERREVIEW, "{\"grade\":\"B\",\"keywords\":[\"old\"]}");
        project.setName("Old title");
        when(userResolver.findUserByEmail("ann@x.edu")).thenReturn(Optional.of(student));
        when(projectHydrator.hydrateOne(PROJECT_ID)).thenReturn(Optional.of(aggregate(project)));
        when(teamMemberRepository.existsByProjectIdAndStudentId(PROJECT_ID, 1L)).thenReturn(true);
        when(projectRepository.save(any(Project.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProjectDetailsRequest request = ProjectDetailsRequest.builder()
                .title("New title")
                .keywords(List.of("health"))
                .status("approved")
                .build();

        service.updateProject(PROJECT_ID, request, "ann@x.edu", UserRole.STUDENT);

        Project saved = captureSavedProject();
        assertThat(saved.getName()).isEqualTo("New title");
        assertThat(saved.getStatus()).isEqualTo(ProjectStatus.UNDERREVIEW);
        ProjectMetadata metadata = codec.decode(saved.getCommentStudent());
        assertThat(metadata.getGrade()).isEqualTo("B");
        assertThat(metadata.getKeywords()).containsExactly("health");

        verify(linkRepository).deleteAllByProjectId(PROJECT_ID);
        verify(linkRepository, never()).saveAll(anyList());
    }

    @Test
    void coordinatorEditInsertsNewLinks() {
        when(userResolver.findUserByEmail("dean@x.edu")).thenReturn(Optional.of(coordinator));
        when(projectHydrator.hydrateOne(PROJECT_ID))
                .thenReturn(Optional.of(aggregate(project(ProjectStatus.UNDERREVIEW, null))));
        when(projectRepository.save(any(Project.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.updateProject(PROJECT_ID, ProjectDetailsRequest.builder()
                .externalLinks(List.of(" https://github.com/team/app ", ""))
                .status("rejected")
                .build(), "dean@x.edu", UserRole.COORDINATOR);

        assertThat(captureSavedProject().getStatus()).isEqualTo(ProjectStatus.REJECT);
        verify(linkRepository).deleteAllByProjectId(PROJECT_ID);
        verify(linkRepository).saveAll(anyList());
        verifyNoInteractions(teamMemberRepository);
    }

    private Project project(ProjectStatus status, String metadata) {
        return Project.builder()
                .id(PROJECT_ID)
                .name("Smart Farm")
                .status(status)
                .advisorId(10L)
                .commentStudent(metadata)
                .build();
    }

    private ProjectAggregate aggregate(Project project) {
        return ProjectAggregate.builder()
                .project(project)
                .metadata(codec.decode(project.getCommentStudent()))
                .build();
    }

    private Project captureSavedProject() {
        ArgumentCaptor<Project> captor = ArgumentCaptor.forClass(Project.class);
        verify(projectRepository).save(captor.capture());
        return captor.getValue();
    }
}
