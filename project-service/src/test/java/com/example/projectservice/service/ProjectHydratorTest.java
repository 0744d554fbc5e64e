package com.example.projectservice.service;

import com.example.projectservice.entity.Link;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.TeamMember;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.PersistenceException;
import com.example.projectservice.metadata.ProjectMetadataCodec;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.repository.LinkRepository;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.TeamMemberRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectHydratorTest {

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TeamMemberRepository teamMemberRepository;

    @Mock
    private LinkRepository linkRepository;

    @Mock
    private UserResolver userResolver;

    private ProjectHydrator hydrator;

    @BeforeEach
    void setUp() {
        hydrator = new ProjectHydrator(projectRepository, teamMemberRepository, linkRepository, userResolver,
                new ProjectMetadataCodec(new ObjectMapper()), new StoreCallHandler(), Runnable::run);
    }

    @Test
    void emptyBatchMakesNoStoreCalls() {
        assertThat(hydrator.hydrate(List.of())).isEmpty();
        assertThat(hydrator.hydrateByIds(List.of())).isEmpty();

        verifyNoInteractions(projectRepository, teamMemberRepository, linkRepository, userResolver);
    }

    @Test
    void batchIsAssembledFromThreeReads() {
        Project first = project(1L, 10L, "{\"grade\":\"A\"}");
        Project second = project(2L, null, null);
        when(teamMemberRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L, 2L))).thenReturn(List.of(
                member(1L, 21L), member(1L, 20L), member(2L, 22L)));
        when(linkRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L, 2L))).thenReturn(List.of(
                Link.builder().projectId(2L).link("https://github.com/team/two").build()));
        when(userResolver.findUsersByIds(anyCollection())).thenReturn(List.of(
                user(20L, UserRole.STUDENT), user(21L, UserRole.STUDENT),
                user(22L, UserRole.STUDENT), user(10L, UserRole.ADVISOR)));

        List<ProjectAggregate> aggregates = hydrator.hydrate(List.of(first, second));

        assertThat(aggregates).extracting(ProjectAggregate::getId).containsExactly(1L, 2L);

        ProjectAggregate one = aggregates.get(0);
        assertThat(one.getStudents()).extracting(User::getId).containsExactly(21L, 20L);
        assertThat(one.getAdvisor().getId()).isEqualTo(10L);
        assertThat(one.getLinks()).isEmpty();
        assertThat(one.getEffectiveGrade()).isEqualTo("A");

        ProjectAggregate two = aggregates.get(1);
        assertThat(two.getAdvisor()).isNull();
        assertThat(two.getMetadata()).isNull();
        assertThat(two.getLinks()).containsExactly("https://github.com/team/two");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Long>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(userResolver).findUsersByIds(ids.capture());
        assertThat(ids.getValue()).containsExactlyInAnyOrder(20L, 21L, 22L, 10L);
    }

    @Test
    void danglingStudentIdIsLeftOut() {
        when(teamMemberRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of(
                member(1L, 20L), member(1L, 99L)));
        when(linkRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of());
        when(userResolver.findUsersByIds(anyCollection())).thenReturn(List.of(user(20L, UserRole.STUDENT)));

        List<ProjectAggregate> aggregates = hydrator.hydrate(List.of(project(1L, null, null)));

        assertThat(aggregates.get(0).getStudents()).extracting(User::getId).containsExactly(20L);
    }

    @Test
    void failingReadFailsTheWholeBatch() {
        when(teamMemberRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(linkRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of());

        assertThatThrownBy(() -> hydrator.hydrate(List.of(project(1L, null, null))))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("selectTeamMembers");
        verify(userResolver, never()).findUsersByIds(any());
    }

    @Test
    void failingUserLookupFailsTheWholeBatch() {
        when(teamMemberRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of(member(1L, 20L)));
        when(linkRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L))).thenReturn(List.of());
        when(userResolver.findUsersByIds(anyCollection()))
                .thenThrow(new PersistenceException("findUsersByIds", new RuntimeException("timeout")));

        assertThatThrownBy(() -> hydrator.hydrate(List.of(project(1L, null, null))))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("findUsersByIds");
    }

    @Test
    void hydrateOneReturnsEmptyForUnknownProject() {
        when(projectRepository.findAllByIdInOrderByIdAsc(List.of(5L))).thenReturn(List.of());

        Optional<ProjectAggregate> result = hydrator.hydrateOne(5L);

        assertThat(result).isEmpty();
        verifyNoInteractions(teamMemberRepository, linkRepository, userResolver);
    }

    private static Project project(Long id, Long advisorId, String metadata) {
        return Project.builder()
                .id(id)
                .name("Project " + id)
                .advisorId(advisorId)
                .commentStudent(metadata)
                .build();
    }

    private static TeamMember member(Long projectId, Long studentId) {
        return TeamMember.builder().projectId(projectId).studentId(studentId).build();
    }

    private static User user(Long id, UserRole role) {
        return User.builder().id(id).name("User " + id).email("user" + id + "@x.edu").role(role).build();
    }
}
