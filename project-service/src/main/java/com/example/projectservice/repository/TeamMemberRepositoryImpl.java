package com.example.projectservice.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Native multi-row upsert for team_member.
 * Row order follows the order of the given student ids so that the serial id
 * keeps reflecting insertion order.
 */
@Repository
@Slf4j
public class TeamMemberRepositoryImpl implements TeamMemberRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public int upsertMembers(Long projectId, Collection<Long> studentIds) {
        if (studentIds == null || studentIds.isEmpty()) {
            return 0;
        }

        List<Long> distinctIds = new ArrayList<>(new LinkedHashSet<>(studentIds));

        StringBuilder sql = new StringBuilder("INSERT INTO team_member (project_id, student_id) VALUES ");
        for (int i = 0; i < distinctIds.size(); i++) {
            sql.append("(?, ?)");
            if (i < distinctIds.size() - 1) {
                sql.append(", ");
            }
        }
        sql.append(" ON CONFLICT (student_id, project_id) DO NOTHING");

        Query query = entityManager.createNativeQuery(sql.toString());
        int paramIndex = 1;
        for (Long studentId : distinctIds) {
            query.setParameter(paramIndex++, projectId);
            query.setParameter(paramIndex++, studentId);
        }

        int inserted = query.executeUpdate();
        log.debug("Upserted team members: projectId={}, requested={}, inserted={}",
                projectId, distinctIds.size(), inserted);
        return inserted;
    }
}
