package com.example.projectservice.repository;

import com.example.projectservice.entity.Link;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface LinkRepository extends JpaRepository<Link, Long> {

    List<Link> findAllByProjectIdInOrderByIdAsc(Collection<Long> projectIds);

    @Transactional
    @Modifying
    @Query("DELETE FROM Link l WHERE l.projectId = :projectId")
    int deleteAllByProjectId(@Param("projectId") Long projectId);
}
