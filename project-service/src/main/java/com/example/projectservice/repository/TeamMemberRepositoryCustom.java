package com.example.projectservice.repository;

import java.util.Collection;

/**
 * Custom repository interface for idempotent team member writes.
 */
public interface TeamMemberRepositoryCustom {

    /**
     * Link students to a project using PostgreSQL ON CONFLICT DO NOTHING.
     * Idempotent: an existing (student_id, project_id) pair is left untouched.
     *
     * @param projectId project to link
     * @param studentIds student ids, duplicates are collapsed
     * @return number of rows inserted
     */
    int upsertMembers(Long projectId, Collection<Long> studentIds);
}
