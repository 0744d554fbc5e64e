package com.example.projectservice.repository;

import com.example.projectservice.entity.ProjectComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectCommentRepository extends JpaRepository<ProjectComment, Long> {

    List<ProjectComment> findAllByProjectIdOrderByCreatedAtAsc(Long projectId);

    /**
     * Most recent comments across all projects.
     */
    List<ProjectComment> findTop50ByOrderByCreatedAtDesc();
}
