package com.example.projectservice.service;

import com.example.projectservice.dto.response.CommentResponse;
import com.example.projectservice.entity.UserRole;

import java.util.List;

/**
 * Discussion comments on projects.
 */
public interface ProjectCommentService {

    /**
     * The 50 most recent comments across all projects, newest first.
     */
    List<CommentResponse> listRecentComments();

    /**
     * Comments of one project, oldest first.
     */
    List<CommentResponse> listComments(Long projectId);

    CommentResponse addComment(Long projectId, String text, String callerEmail);

    /**
     * Authorization: the comment's author or any COORDINATOR
     */
    void deleteComment(Long commentId, String callerEmail, UserRole callerRole);
}
