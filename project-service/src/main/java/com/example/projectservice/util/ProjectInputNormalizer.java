package com.example.projectservice.util;

import com.example.projectservice.entity.ProjectStatus;
import com.example.projectservice.entity.ProjectType;
import com.example.projectservice.entity.Semester;
import com.example.projectservice.exception.BadRequestException;
import com.example.projectservice.metadata.FileEntry;
import com.example.projectservice.metadata.TeamMemberEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps free-text submission input onto the fixed column values.
 * Unrecognised text falls back to a default; nothing here rejects input except grades.
 */
@Component
@Slf4j
public class ProjectInputNormalizer {

    private static final Map<String, ProjectType> PROJECT_TYPE_LOOKUP = Map.of(
            "capstone", ProjectType.ACADEMIC,
            "academic publication", ProjectType.ACADEMIC,
            "competition work", ProjectType.COMPETITION,
            "competition", ProjectType.COMPETITION,
            "social service", ProjectType.SERVICE,
            "service", ProjectType.SERVICE,
            "other", ProjectType.OTHER
    );

    private static final Map<String, ProjectStatus> PROJECT_STATUS_LOOKUP = Map.of(
            "draft", ProjectStatus.DRAFT,
            "under review", ProjectStatus.UNDERREVIEW,
            "submitted", ProjectStatus.UNDERREVIEW,
            "in review", ProjectStatus.UNDERREVIEW,
            "approved", ProjectStatus.APPROVED,
            "completed", ProjectStatus.APPROVED,
            "reject", ProjectStatus.REJECT,
            "rejected", ProjectStatus.REJECT,
            "deny", ProjectStatus.REJECT
    );

    private static final Map<String, String> KEYWORD_LOOKUP = Map.of(
            "ai", "ai",
            "service", "service",
            "game", "game",
            "gaming", "game",
            "health", "health",
            "academic", "academic",
            "research", "academic",
            "other", "other"
    );

    public static final String DEFAULT_KEYWORD = "other";

    public static final Set<String> GRADE_VALUES = Set.of("A", "B+", "B", "C+", "C", "D+", "D", "F");

    private final Clock clock;

    public ProjectInputNormalizer() {
        this(Clock.systemDefaultZone());
    }

    ProjectInputNormalizer(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Trimmed value, or null when absent or blank.
     */
    public String normalizeString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Trimmed non-blank entries, in input order. Never null.
     */
    public List<String> normalizeStrings(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            String normalized = normalizeString(value);
            if (normalized != null) {
                result.add(normalized);
            }
        }
        return result;
    }

    public ProjectType normalizeProjectType(String value) {
        String candidate = normalizeString(value);
        if (candidate == null) {
            return ProjectType.OTHER;
        }
        return PROJECT_TYPE_LOOKUP.getOrDefault(candidate.toLowerCase(Locale.ROOT), ProjectType.OTHER);
    }

    /**
     * "submitted", "in review" map to underreview, "completed" to approved, "deny" to reject.
     * Blank or unknown text gives underreview.
     */
    public ProjectStatus normalizeStatus(String value) {
        String candidate = normalizeString(value);
        if (candidate == null) {
            return ProjectStatus.UNDERREVIEW;
        }
        return PROJECT_STATUS_LOOKUP.getOrDefault(candidate.toLowerCase(Locale.ROOT), ProjectStatus.UNDERREVIEW);
    }

    /**
     * Any text containing "2" is the second semester.
     */
    public Semester normalizeSemester(String value) {
        String candidate = normalizeString(value);
        if (candidate != null && candidate.contains("2")) {
            return Semester.SECOND;
        }
        return Semester.FIRST;
    }

    /**
     * First recognised keyword wins.
     */
    public String resolveKeyword(List<String> keywords) {
        if (keywords == null) {
            return DEFAULT_KEYWORD;
        }
        return keywords.stream()
                .filter(keyword -> keyword != null)
                .map(keyword -> KEYWORD_LOOKUP.get(keyword.trim().toLowerCase(Locale.ROOT)))
                .filter(mapped -> mapped != null)
                .findFirst()
                .orElse(DEFAULT_KEYWORD);
    }

    /**
     * @return upper-cased grade, or null when blank (clears the grade)
     * @throws BadRequestException for a value outside {@link #GRADE_VALUES}
     */
    public String normalizeGrade(String value) {
        String candidate = normalizeString(value);
        if (candidate == null) {
            return null;
        }
        String grade = candidate.toUpperCase(Locale.ROOT);
        if (!GRADE_VALUES.contains(grade)) {
            throw BadRequestException.unsupportedGrade(candidate);
        }
        return grade;
    }

    /**
     * Keeps members with an e-mail and a student or lecturer role (default student).
     */
    public List<TeamMemberEntry> normalizeTeamMembers(List<TeamMemberEntry> members) {
        List<TeamMemberEntry> result = new ArrayList<>();
        if (members == null) {
            return result;
        }
        for (TeamMemberEntry member : members) {
            if (member == null) {
                continue;
            }
            String email = normalizeString(member.getEmail());
            String role = normalizeString(member.getRole());
            String roleKey = role == null ? TeamMemberEntry.ROLE_STUDENT : role.toLowerCase(Locale.ROOT);
            if (email == null
                    || !(TeamMemberEntry.ROLE_STUDENT.equals(roleKey) || TeamMemberEntry.ROLE_LECTURER.equals(roleKey))) {
                log.debug("Dropping team member entry without e-mail or with unsupported role: role={}", role);
                continue;
            }
            String name = normalizeString(member.getName());
            result.add(TeamMemberEntry.builder()
                    .id(normalizeString(member.getId()))
                    .name(name == null ? "" : name)
                    .email(email)
                    .role(roleKey)
                    .primary(member.isPrimaryMember())
                    .build());
        }
        return result;
    }

    /**
     * Prepends the submitter as a student when absent, then makes sure exactly
     * one entry is primary when none was flagged.
     */
    public List<TeamMemberEntry> ensureSubmitter(List<TeamMemberEntry> members,
                                                 Long submitterId, String submitterName, String submitterEmail) {
        List<TeamMemberEntry> result = new ArrayList<>(members);
        boolean present = result.stream()
                .anyMatch(member -> member.getEmail().equalsIgnoreCase(submitterEmail));
        if (!present) {
            boolean nonePrimary = result.stream().noneMatch(TeamMemberEntry::isPrimaryMember);
            result.add(0, TeamMemberEntry.builder()
                    .id(submitterId == null ? null : submitterId.toString())
                    .name(submitterName)
                    .email(submitterEmail)
                    .role(TeamMemberEntry.ROLE_STUDENT)
                    .primary(nonePrimary)
                    .build());
        }
        if (result.stream().noneMatch(TeamMemberEntry::isPrimaryMember)) {
            result.get(0).setPrimary(true);
        }
        return result;
    }

    /**
     * The first lecturer entry is the advisor candidate.
     */
    public Optional<TeamMemberEntry> pickAdvisorCandidate(List<TeamMemberEntry> members) {
        return members.stream().filter(TeamMemberEntry::isLecturer).findFirst();
    }

    /**
     * Keeps file descriptors that carry a name.
     */
    public List<FileEntry> normalizeFiles(List<FileEntry> files) {
        List<FileEntry> result = new ArrayList<>();
        if (files == null) {
            return result;
        }
        for (FileEntry file : files) {
            if (file == null) {
                continue;
            }
            String name = normalizeString(file.getName());
            if (name != null) {
                result.add(FileEntry.builder().name(name).size(file.getSize()).type(file.getType()).build());
            }
        }
        return result;
    }

    /**
     * Parses an ISO date ("2025-05-30") or date-time; null when absent or unparsable.
     */
    public LocalDate parseDate(String value) {
        String candidate = normalizeString(value);
        if (candidate == null) {
            return null;
        }
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(candidate).toLocalDate();
            } catch (DateTimeParseException ex) {
                log.debug("Unparsable date value: {}", candidate);
                return null;
            }
        }
    }

    /**
     * Year of the given date, or the current year when absent or unparsable.
     */
    public int yearOf(String date) {
        LocalDate parsed = parseDate(date);
        return parsed != null ? parsed.getYear() : today().getYear();
    }
}
