package com.example.projectservice.repository;

import com.example.projectservice.entity.Project;
import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.ProjectType;
import com.example.projectservice.entity.Semester;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Project queries against an in-memory database.
 * Schema comes from the entity mappings; the PostgreSQL migrations are not run here.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:projects;MODE=PostgreSQL;NON_KEYWORDS=YEAR,USER;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.flyway.enabled=false"
})
class ProjectRepositoryTest {

    @Autowired
    private ProjectRepository projectRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Test
    void newProjectDefaultsToDraftWithCreationTime() {
        Project saved = projectRepository.saveAndFlush(Project.builder()
                .name("Untitled")
                .keyword("other")
                .projectType(ProjectType.OTHER)
                .semester(Semester.FIRST)
                .year(2025)
                .build());

        assertEquals(ProjectStatus.DRAFT, saved.getStatus());
        assertNotNull(saved.getCreatedAt());
        assertNotNull(saved.getVersion());
    }

    @Test
    void finderQueriesReturnRowsInIdOrder() {
        Project first = save("Alpha", ProjectStatus.APPROVED, 10L, 7L);
        Project second = save("Beta", ProjectStatus.UNDERREVIEW, 10L, 8L);
        Project third = save("Gamma", ProjectStatus.APPROVED, 11L, 7L);

        assertEquals(List.of(first.getId(), third.getId()),
                ids(projectRepository.findAllByStatusOrderByIdAsc(ProjectStatus.APPROVED)));
        assertEquals(List.of(first.getId(), second.getId()),
                ids(projectRepository.findAllByAdvisorIdOrderByIdAsc(10L)));
        assertEquals(List.of(first.getId(), third.getId()),
                ids(projectRepository.findAllByCourseIdOrderByIdAsc(7L)));
        assertEquals(List.of(first.getId(), third.getId()),
                ids(projectRepository.findAllByIdInOrderByIdAsc(List.of(third.getId(), first.getId(), 9999L))));
    }

    @Test
    void statusIsStoredAsLowercaseValue() {
        Project saved = save("Alpha", ProjectStatus.UNDERREVIEW, null, null);

        Object stored = entityManager
                .createNativeQuery("SELECT status FROM project WHERE id = :id")
                .setParameter("id", saved.getId())
                .getSingleResult();

        assertEquals("underreview", stored);
    }

    @Test
    void clearingAdvisorKeepsProjects() {
        Project advised = save("Alpha", ProjectStatus.UNDERREVIEW, 10L, null);
        Project alsoAdvised = save("Beta", ProjectStatus.APPROVED, 10L, null);
        Project other = save("Gamma", ProjectStatus.APPROVED, 11L, null);

        int cleared = projectRepository.clearAdvisorReferences(10L);
        entityManager.clear();

        assertEquals(2, cleared);
        assertNull(projectRepository.findById(advised.getId()).orElseThrow().getAdvisorId());
        assertNull(projectRepository.findById(alsoAdvised.getId()).orElseThrow().getAdvisorId());
        assertEquals(11L, projectRepository.findById(other.getId()).orElseThrow().getAdvisorId());
        assertEquals(0, projectRepository.clearAdvisorReferences(10L));
    }

    @Test
    void staleWriteIsRejected() {
        Long id = save("Alpha", ProjectStatus.UNDERREVIEW, 10L, null).getId();
        entityManager.clear();

        Project firstReader = projectRepository.findById(id).orElseThrow();
        entityManager.detach(firstReader);
        Project secondReader = projectRepository.findById(id).orElseThrow();
        entityManager.detach(secondReader);

        firstReader.transitionTo(ProjectStatus.APPROVED);
        Project updated = projectRepository.saveAndFlush(firstReader);
        assertTrue(updated.getVersion() > secondReader.getVersion());
        entityManager.clear();

        secondReader.transitionTo(ProjectStatus.REJECT);
        assertThrows(OptimisticLockingFailureException.class, () -> projectRepository.saveAndFlush(secondReader));
    }

    @Test
    void rowInsertedWithoutVersionCanBeUpdated() {
        entityManager.createNativeQuery(
                        "INSERT INTO project (id, name, keyword, project_type, status, semester, year, created_at) "
                                + "VALUES (500, 'Legacy', 'other', 'other', 'underreview', '1', 2024, CURRENT_TIMESTAMP)")
                .executeUpdate();
        entityManager.clear();

        Project legacy = projectRepository.findById(500L).orElseThrow();
        assertEquals(0, legacy.getVersion());
        entityManager.detach(legacy);

        legacy.setAdvisorId(10L);
        Project updated = projectRepository.saveAndFlush(legacy);
        entityManager.clear();

        assertEquals(1, updated.getVersion());
        assertEquals(10L, projectRepository.findById(500L).orElseThrow().getAdvisorId());
    }

    private Project save(String name, ProjectStatus status, Long advisorId, Long courseId) {
        return projectRepository.saveAndFlush(Project.builder()
                .name(name)
                .keyword("ai")
                .projectType(ProjectType.ACADEMIC)
                .status(status)
                .semester(Semester.SECOND)
                .year(2025)
                .advisorId(advisorId)
                .courseId(courseId)
                .build());
    }

    private static List<Long> ids(List<Project> projects) {
        return projects.stream().map(Project::getId).toList();
    }
}
