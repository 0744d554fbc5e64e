package com.example.projectservice.dto.response;

import com.example.projectservice.entity.ProjectComment;
import com.example.projectservice.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Comment with its author resolved. A deleted author is shown as "Unknown User".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

    private Long id;
    private Long projectId;
    private String projectTitle;
    private Long userId;
    private String userName;
    private String userEmail;
    private String userRole;
    private String comment;
    private Instant createdAt;
    private Instant updatedAt;

    public static CommentResponse from(ProjectComment comment, User author, String projectTitle) {
        return CommentResponse.builder()
                .id(comment.getId())
                .projectId(comment.getProjectId())
                .projectTitle(projectTitle)
                .userId(comment.getUserId())
                .userName(author != null ? author.getName() : "Unknown User")
                .userEmail(author != null ? author.getEmail() : "")
                .userRole(author != null && author.getRole() != null ? author.getRole().getValue() : "user")
                .comment(comment.getComment())
                .createdAt(comment.getCreatedAt())
                .updatedAt(comment.getUpdatedAt())
                .build();
    }
}
