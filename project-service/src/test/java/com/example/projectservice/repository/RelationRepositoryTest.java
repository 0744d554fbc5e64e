package com.example.projectservice.repository;

import com.example.projectservice.entity.Link;
import com.example.projectservice.entity.TeamMember;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Team member, link and user lookups. The PostgreSQL-only member upsert is not exercised here.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:relations;MODE=PostgreSQL;NON_KEYWORDS=YEAR,USER;DB_CLOSE_DELAY=-1",
        "spring.datasource.driver-class-name=org.h2.Driver",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "spring.flyway.enabled=false"
})
class RelationRepositoryTest {

    @Autowired
    private TeamMemberRepository teamMemberRepository;

    @Autowired
    private LinkRepository linkRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        entityManager.persist(User.builder().id(1L).name("Ann").email("Ann@X.edu").role(UserRole.STUDENT).build());
        entityManager.persist(User.builder().id(10L).name("Lee").email("lee@x.edu").role(UserRole.ADVISOR).build());
        entityManager.flush();
    }

    @Test
    void membersAreReturnedInInsertionOrder() {
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(2L).studentId(3L).build());
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(1L).studentId(5L).build());
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(2L).studentId(1L).build());

        assertThat(teamMemberRepository.findAllByProjectIdInOrderByIdAsc(List.of(2L)))
                .extracting(TeamMember::getStudentId)
                .containsExactly(3L, 1L);
        assertThat(teamMemberRepository.findAllByStudentIdOrderByIdAsc(1L))
                .extracting(TeamMember::getProjectId)
                .containsExactly(2L);
        assertThat(teamMemberRepository.existsByProjectIdAndStudentId(1L, 5L)).isTrue();
        assertThat(teamMemberRepository.existsByProjectIdAndStudentId(1L, 3L)).isFalse();
    }

    @Test
    void deletingMembersOnlyTouchesOneProject() {
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(1L).studentId(1L).build());
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(1L).studentId(2L).build());
        teamMemberRepository.saveAndFlush(TeamMember.builder().projectId(2L).studentId(1L).build());

        assertThat(teamMemberRepository.deleteAllByProjectId(1L)).isEqualTo(2);
        entityManager.clear();

        assertThat(teamMemberRepository.findAll())
                .extracting(TeamMember::getProjectId)
                .containsExactly(2L);
    }

    @Test
    void linkSetIsReplacedPerProject() {
        linkRepository.saveAllAndFlush(List.of(
                Link.builder().projectId(1L).link("https://a.example").build(),
                Link.builder().projectId(1L).link("https://b.example").build(),
                Link.builder().projectId(2L).link("https://c.example").build()));

        assertThat(linkRepository.deleteAllByProjectId(1L)).isEqualTo(2);
        entityManager.clear();

        assertThat(linkRepository.findAllByProjectIdInOrderByIdAsc(List.of(1L, 2L)))
                .extracting(Link::getLink)
                .containsExactly("https://c.example");
    }

    @Test
    void userEmailLookupIgnoresCase() {
        assertThat(userRepository.findFirstByEmailIgnoreCase("ann@x.edu"))
                .map(User::getId)
                .contains(1L);
        assertThat(userRepository.findAllByIdIn(List.of(1L, 10L, 99L)))
                .extracting(User::getRole)
                .containsExactlyInAnyOrder(UserRole.STUDENT, UserRole.ADVISOR);
    }
}
