package com.example.projectservice.service;

import com.example.projectservice.entity.Link;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.TeamMember;
import com.example.projectservice.entity.User;
import com.example.projectservice.metadata.ProjectMetadataCodec;
import com.example.projectservice.model.ProjectAggregate;
import com.example.projectservice.repository.LinkRepository;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.repository.TeamMemberRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Assembles {@link ProjectAggregate}s from independently queried tables.
 *
 * <p>For a batch of project rows it issues exactly three reads, whatever the batch size:
 * team members and links for all project ids (in parallel), then one user lookup for the
 * union of student ids and advisor ids once the team members are known. Results are joined
 * in memory.
 *
 * <p>Any failing read fails the whole batch; no partial aggregates are returned.
 * Student ids without a matching user are skipped.
 */
@Component
@Slf4j
public class ProjectHydrator {

    private final ProjectRepository projectRepository;
    private final TeamMemberRepository teamMemberRepository;
    private final LinkRepository linkRepository;
    private final UserResolver userResolver;
    private final ProjectMetadataCodec metadataCodec;
    private final StoreCallHandler storeCallHandler;
    private final Executor executor;

    public ProjectHydrator(ProjectRepository projectRepository,
                           TeamMemberRepository teamMemberRepository,
                           LinkRepository linkRepository,
                           UserResolver userResolver,
                           ProjectMetadataCodec metadataCodec,
                           StoreCallHandler storeCallHandler,
                           @Qualifier("hydrationExecutor") Executor executor) {
        this.projectRepository = projectRepository;
        this.teamMemberRepository = teamMemberRepository;
        this.linkRepository = linkRepository;
        this.userResolver = userResolver;
        this.metadataCodec = metadataCodec;
        this.storeCallHandler = storeCallHandler;
        this.executor = executor;
    }

    /**
     * Hydrate a batch of project rows, preserving input order.
     *
     * @return one aggregate per input row; empty without any store call for empty input
     */
    public List<ProjectAggregate> hydrate(List<Project> projects) {
        if (projects == null || projects.isEmpty()) {
            return List.of();
        }

        List<Long> projectIds = projects.stream()
                .map(Project::getId)
                .distinct()
                .toList();

        CompletableFuture<List<TeamMember>> membersFuture = CompletableFuture.supplyAsync(
                () -> storeCallHandler.handleStoreCall(
                        () -> teamMemberRepository.findAllByProjectIdInOrderByIdAsc(projectIds),
                        "selectTeamMembers"),
                executor);

        CompletableFuture<List<Link>> linksFuture = CompletableFuture.supplyAsync(
                () -> storeCallHandler.handleStoreCall(
                        () -> linkRepository.findAllByProjectIdInOrderByIdAsc(projectIds),
                        "selectLinks"),
                executor);

        CompletableFuture<Map<Long, User>> usersFuture = membersFuture.thenApplyAsync(
                members -> loadUsers(projects, members),
                executor);

        List<TeamMember> members;
        List<Link> links;
        Map<Long, User> usersById;
        try {
            CompletableFuture.allOf(membersFuture, linksFuture, usersFuture).join();
            members = membersFuture.join();
            links = linksFuture.join();
            usersById = usersFuture.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        Map<Long, List<Long>> studentIdsByProject = new HashMap<>();
        for (TeamMember member : members) {
            studentIdsByProject.computeIfAbsent(member.getProjectId(), id -> new ArrayList<>())
                    .add(member.getStudentId());
        }

        Map<Long, List<String>> linksByProject = new HashMap<>();
        for (Link link : links) {
            linksByProject.computeIfAbsent(link.getProjectId(), id -> new ArrayList<>())
                    .add(link.getLink());
        }

        List<ProjectAggregate> aggregates = new ArrayList<>(projects.size());
        for (Project project : projects) {
            List<User> students = studentIdsByProject.getOrDefault(project.getId(), List.of()).stream()
                    .map(usersById::get)
                    .filter(user -> user != null)
                    .toList();

            aggregates.add(ProjectAggregate.builder()
                    .project(project)
                    .advisor(project.getAdvisorId() == null ? null : usersById.get(project.getAdvisorId()))
                    .students(students)
                    .metadata(metadataCodec.decode(project.getCommentStudent()))
                    .links(linksByProject.getOrDefault(project.getId(), List.of()))
                    .build());
        }

        log.debug("Hydrated projects: count={}, teamMembers={}, links={}, users={}",
                aggregates.size(), members.size(), links.size(), usersById.size());
        return aggregates;
    }

    /**
     * Load and hydrate a single project through the batch path.
     *
     * @return empty when no project has this id
     */
    public Optional<ProjectAggregate> hydrateOne(Long projectId) {
        if (projectId == null) {
            return Optional.empty();
        }
        List<Project> rows = storeCallHandler.handleStoreCall(
                () -> projectRepository.findAllByIdInOrderByIdAsc(List.of(projectId)),
                "selectProject");
        return hydrate(rows).stream().findFirst();
    }

    /**
     * Load and hydrate projects by id, ordered by id. Unknown ids are skipped.
     */
    public List<ProjectAggregate> hydrateByIds(Collection<Long> projectIds) {
        if (projectIds == null || projectIds.isEmpty()) {
            return List.of();
        }
        List<Project> rows = storeCallHandler.handleStoreCall(
                () -> projectRepository.findAllByIdInOrderByIdAsc(projectIds),
                "selectProjects");
        return hydrate(rows);
    }

    private Map<Long, User> loadUsers(List<Project> projects, List<TeamMember> members) {
        Set<Long> userIds = new LinkedHashSet<>();
        members.forEach(member -> userIds.add(member.getStudentId()));
        projects.stream()
                .map(Project::getAdvisorId)
                .filter(advisorId -> advisorId != null)
                .forEach(userIds::add);

        if (userIds.isEmpty()) {
            return Map.of();
        }

        return userResolver.findUsersByIds(userIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity(), (first, second) -> first));
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Project hydration failed", cause != null ? cause : e);
    }
}
