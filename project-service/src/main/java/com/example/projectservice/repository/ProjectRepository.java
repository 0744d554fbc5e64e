package com.example.projectservice.repository;

import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the project table.
 * Single-table reads only: related rows are fetched by ProjectHydrator, never joined here.
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    List<Project> findAllByOrderByIdAsc();

    List<Project> findAllByIdInOrderByIdAsc(Collection<Long> ids);

    List<Project> findAllByAdvisorIdOrderByIdAsc(Long advisorId);

    List<Project> findAllByCourseIdOrderByIdAsc(Long courseId);

    List<Project> findAllByStatusOrderByIdAsc(ProjectStatus status);

    /**
     * Clear the advisor reference of every project advised by a deleted user.
     * Projects themselves are kept.
     *
     * @return number of projects updated
     */
    @Transactional
    @Modifying
    @Query("UPDATE Project p SET p.advisorId = NULL WHERE p.advisorId = :advisorId")
    int clearAdvisorReferences(@Param("advisorId") Long advisorId);
}
