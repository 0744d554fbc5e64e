package com.example.projectservice.controller;

import com.example.projectservice.dto.request.CreateCommentRequest;
import com.example.projectservice.dto.response.CommentResponse;
import com.example.projectservice.exception.UnauthorizedException;
import com.example.projectservice.security.CurrentUser;
import com.example.projectservice.service.ProjectCommentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for project comments. All endpoints require authentication;
 * deletion is limited to the author or a coordinator.
 */
@RestController
@RequestMapping("/api/comments")
@RequiredArgsConstructor
public class ProjectCommentController {

    private final ProjectCommentService commentService;

    @GetMapping("/all")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<CommentResponse>> listRecentComments() {
        return ResponseEntity.ok(commentService.listRecentComments());
    }

    @GetMapping("/project/{projectId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<CommentResponse>> listComments(@PathVariable Long projectId) {
        return ResponseEntity.ok(commentService.listComments(projectId));
    }

    @PostMapping("/project/{projectId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CommentResponse> addComment(
            @PathVariable Long projectId,
            @Valid @RequestBody CreateCommentRequest request,
            @AuthenticationPrincipal CurrentUser currentUser) {

        CommentResponse response = commentService.addComment(projectId, request.getComment(), currentUser.getEmail());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{commentId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> deleteComment(
            @PathVariable Long commentId,
            @AuthenticationPrincipal CurrentUser currentUser) {

        commentService.deleteComment(commentId, currentUser.getEmail(),
                currentUser.getRole().orElseThrow(UnauthorizedException::missingRole));
        return ResponseEntity.noContent().build();
    }
}
