package com.example.projectservice.repository;

import com.example.projectservice.entity.TeamMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for team_member rows.
 * Reads are ordered by id, i.e. insertion order.
 */
@Repository
public interface TeamMemberRepository extends JpaRepository<TeamMember, Long>, TeamMemberRepositoryCustom {

    List<TeamMember> findAllByProjectIdInOrderByIdAsc(Collection<Long> projectIds);

    List<TeamMember> findAllByStudentIdOrderByIdAsc(Long studentId);

    boolean existsByProjectIdAndStudentId(Long projectId, Long studentId);

    @Transactional
    @Modifying
    @Query("DELETE FROM TeamMember tm WHERE tm.projectId = :projectId")
    int deleteAllByProjectId(@Param("projectId") Long projectId);
}
