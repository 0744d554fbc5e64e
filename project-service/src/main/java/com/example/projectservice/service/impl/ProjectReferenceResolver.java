package com.example.projectservice.service.impl;

import com.example.projectservice.entity.Course;
import com.example.projectservice.entity.User;
import com.example.projectservice.entity.UserRole;
import com.example.projectservice.metadata.TeamMemberEntry;
import com.example.projectservice.repository.CourseRepository;
import com.example.projectservice.repository.StoreCallHandler;
import com.example.projectservice.service.UserResolver;
import com.example.projectservice.util.ProjectInputNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the weak references a submission carries: advisor and course.
 */
@Component
@RequiredArgsConstructor
@Slf4j
class ProjectReferenceResolver {

    private final UserResolver userResolver;
    private final CourseRepository courseRepository;
    private final StoreCallHandler storeCallHandler;
    private final ProjectInputNormalizer normalizer;

    /**
     * First lecturer entry resolved to a non-student user.
     *
     * @return null when there is no lecturer entry or its e-mail does not resolve
     */
    User resolveAdvisor(List<TeamMemberEntry> members) {
        return normalizer.pickAdvisorCandidate(members)
                .flatMap(candidate -> userResolver.findUserByEmail(candidate.getEmail()))
                .filter(user -> {
                    if (user.getRole() == UserRole.STUDENT) {
                        log.warn("Lecturer entry resolves to a student account, advisor left empty: userId={}",
                                user.getId());
                        return false;
                    }
                    return true;
                })
                .orElse(null);
    }

    /**
     * @return course id, or null for a blank or unknown code
     */
    Long resolveCourseId(String courseCode) {
        String code = normalizer.normalizeString(courseCode);
        if (code == null) {
            return null;
        }
        return storeCallHandler.handleStoreCall(
                        () -> courseRepository.findFirstByCourseCode(code),
                        "findCourseByCode")
                .map(Course::getId)
                .orElse(null);
    }
}
