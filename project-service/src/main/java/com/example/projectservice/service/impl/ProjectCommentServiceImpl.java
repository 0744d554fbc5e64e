package com.example.projectservice.service.impl;

import com.example.projectservice.dto.response.CommentResponse;
import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectComment;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.exception.BadRequestException;
import com.example.projectservice.exception.ForbiddenException;
import com.example.projectservice.exception.ResourceNotFoundException;
import com.example.projectservice.exception.UnauthorizedException;
import com.example.projectservice.repository.ProjectCommentRepository;
import com.example.projectservice.repository.ProjectRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.service.ProjectCommentService;
import com.example.projectservice.service.UserResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of ProjectCommentService.
 * Authors and project titles are resolved with one batched lookup per listing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectCommentServiceImpl implements ProjectCommentService {

    private static final String UNKNOWN_PROJECT = "Unknown Project";

    private final ProjectCommentRepository commentRepository;
    private final ProjectRepository projectRepository;
    private final UserResolver userResolver;
    private final StoreCallHandler storeCallHandler;

    @Override
    public List<CommentResponse> listRecentComments() {
        List<ProjectComment> comments = storeCallHandler.handleStoreCall(
                commentRepository::findTop50ByOrderByCreatedAtDesc, "selectRecentComments");

        List<Long> projectIds = comments.stream().map(ProjectComment::getProjectId).distinct().toList();
        Map<Long, String> titles = projectIds.isEmpty()
                ? Map.of()
                : storeCallHandler.handleStoreCall(
                                () -> projectRepository.findAllByIdInOrderByIdAsc(projectIds),
                                "selectCommentProjects")
                        .stream()
                        .collect(Collectors.toMap(Project::getId, Project::getName, (first, second) -> first));
        Map<Long, User> authors = loadAuthors(comments);

        return comments.stream()
                .map(comment -> CommentResponse.from(
                        comment,
                        authors.get(comment.getUserId()),
                        titles.getOrDefault(comment.getProjectId(), UNKNOWN_PROJECT)))
                .toList();
    }

    @Override
    public List<CommentResponse> listComments(Long projectId) {
        Project project = findProject(projectId);
        List<ProjectComment> comments = storeCallHandler.handleStoreCall(
                () -> commentRepository.findAllByProjectIdOrderByCreatedAtAsc(projectId),
                "selectProjectComments");
        Map<Long, User> authors = loadAuthors(comments);

        return comments.stream()
                .map(comment -> CommentResponse.from(comment, authors.get(comment.getUserId()), project.getName()))
                .toList();
    }

    @Override
    public CommentResponse addComment(Long projectId, String text, String callerEmail) {
        if (text == null || text.isBlank()) {
            throw BadRequestException.validation("Comment text is required");
        }
        User author = resolveCaller(callerEmail);
        Project project = findProject(projectId);

        ProjectComment comment = ProjectComment.builder()
                .projectId(projectId)
                .userId(author.getId())
                .comment(text.trim())
                .build();
        ProjectComment saved = storeCallHandler.handleStoreCall(
                () -> commentRepository.save(comment), "insertComment");

        log.info("Comment added: commentId={}, projectId={}, userId={}", saved.getId(), projectId, author.getId());
        return CommentResponse.from(saved, author, project.getName());
    }

    @Override
    public void deleteComment(Long commentId, String callerEmail, UserRole callerRole) {
        User caller = resolveCaller(callerEmail);
        ProjectComment comment = storeCallHandler.handleStoreCall(
                        () -> commentRepository.findById(commentId), "selectComment")
                .orElseThrow(() -> ResourceNotFoundException.commentNotFound(commentId));

        if (!Objects.equals(comment.getUserId(), caller.getId()) && callerRole != UserRole.COORDINATOR) {
            throw ForbiddenException.notCommentAuthor();
        }

        storeCallHandler.runStoreCall(() -> commentRepository.delete(comment), "deleteComment");
        log.info("Comment deleted: commentId={}, callerId={}", commentId, caller.getId());
    }

    private Project findProject(Long projectId) {
        return storeCallHandler.handleStoreCall(() -> projectRepository.findById(projectId), "selectProject")
                .orElseThrow(() -> ResourceNotFoundException.projectNotFound(projectId));
    }

    private User resolveCaller(String callerEmail) {
        if (callerEmail == null || callerEmail.isBlank()) {
            throw UnauthorizedException.missingEmail();
        }
        return userResolver.findUserByEmail(callerEmail)
                .orElseThrow(ResourceNotFoundException::callerNotFound);
    }

    private Map<Long, User> loadAuthors(List<ProjectComment> comments) {
        List<Long> userIds = comments.stream().map(ProjectComment::getUserId).distinct().toList();
        return userResolver.findUsersByIds(userIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity(), (first, second) -> first));
    }
}
