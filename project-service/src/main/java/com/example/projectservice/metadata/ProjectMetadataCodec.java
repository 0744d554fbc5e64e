package com.example.projectservice.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Converts the metadata bag to and from its text column.
 *
 * <p>Decoding is permissive: absent, malformed or non-object input yields {@code null},
 * and array fields keep only the elements that have the expected shape. Nothing here throws
 * on stored content.
 *
 * <p>Encoding is canonical: known keys in a fixed order, then unknown keys sorted by name,
 * null fields omitted. An empty bag encodes to {@code null}.
 */
@Component
@Slf4j
public class ProjectMetadataCodec {

    static final String KEYWORDS = "keywords";
    static final String EXTERNAL_LINKS = "externalLinks";
    static final String TEAM_MEMBERS = "teamMembers";
    static final String AWARD = "award";
    static final String COURSE_CODE = "courseCode";
    static final String COMPLETION_DATE = "completionDate";
    static final String FILES = "files";
    static final String GRADE = "grade";

    private static final Set<String> KNOWN_KEYS = Set.of(
            KEYWORDS, EXTERNAL_LINKS, TEAM_MEMBERS, AWARD, COURSE_CODE, COMPLETION_DATE, FILES, GRADE);

    private final ObjectMapper objectMapper;

    public ProjectMetadataCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param raw stored column value, may be null
     * @return decoded bag, or null when the value is absent, unparsable or not a JSON object
     */
    public ProjectMetadata decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unparsable metadata: {}", e.getOriginalMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        Map<String, JsonNode> additional = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_KEYS.contains(field.getKey())) {
                additional.put(field.getKey(), field.getValue());
            }
        }

        return ProjectMetadata.builder()
                .keywords(readStrings(root.get(KEYWORDS)))
                .externalLinks(readStrings(root.get(EXTERNAL_LINKS)))
                .teamMembers(readTeamMembers(root.get(TEAM_MEMBERS)))
                .award(readText(root.get(AWARD)))
                .courseCode(readText(root.get(COURSE_CODE)))
                .completionDate(readText(root.get(COMPLETION_DATE)))
                .files(readFiles(root.get(FILES)))
                .grade(readText(root.get(GRADE)))
                .additional(additional)
                .build();
    }

    /**
     * @return canonical JSON text, or null for a null or empty bag
     */
    public String encode(ProjectMetadata metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }

        ObjectNode root = objectMapper.createObjectNode();
        if (metadata.getKeywords() != null) {
            root.set(KEYWORDS, objectMapper.valueToTree(metadata.getKeywords()));
        }
        if (metadata.getExternalLinks() != null) {
            root.set(EXTERNAL_LINKS, objectMapper.valueToTree(metadata.getExternalLinks()));
        }
        if (metadata.getTeamMembers() != null) {
            root.set(TEAM_MEMBERS, objectMapper.valueToTree(metadata.getTeamMembers()));
        }
        putText(root, AWARD, metadata.getAward());
        putText(root, COURSE_CODE, metadata.getCourseCode());
        putText(root, COMPLETION_DATE, metadata.getCompletionDate());
        if (metadata.getFiles() != null) {
            root.set(FILES, objectMapper.valueToTree(metadata.getFiles()));
        }
        putText(root, GRADE, metadata.getGrade());

        if (metadata.getAdditional() != null) {
            new TreeMap<>(metadata.getAdditional()).forEach((key, value) -> {
                if (!KNOWN_KEYS.contains(key) && value != null) {
                    root.set(key, value);
                }
            });
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // A tree built from strings and JSON nodes always serializes
            throw new IllegalStateException("Failed to encode project metadata", e);
        }
    }

    private static void putText(ObjectNode root, String key, String value) {
        if (value != null) {
            root.put(key, value);
        }
    }

    private static String readText(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /**
     * Text of a scalar value, numbers included. Objects, arrays and null give null.
     */
    private static String readScalar(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static List<String> readStrings(JsonNode node) {
        if (!(node instanceof ArrayNode array)) {
            return null;
        }
        List<String> values = new ArrayList<>();
        array.forEach(element -> {
            if (element.isTextual()) {
                values.add(element.asText());
            }
        });
        return values;
    }

    private static List<TeamMemberEntry> readTeamMembers(JsonNode node) {
        if (!(node instanceof ArrayNode array)) {
            return null;
        }
        List<TeamMemberEntry> members = new ArrayList<>();
        array.forEach(element -> {
            if (!element.isObject() || !element.path("email").isTextual()) {
                return;
            }
            JsonNode primary = element.get("isPrimary");
            members.add(TeamMemberEntry.builder()
                    .id(readScalar(element.get("id")))
                    .name(readText(element.get("name")))
                    .email(element.get("email").asText())
                    .role(readText(element.get("role")))
                    .primary(primary != null && primary.isBoolean() ? primary.asBoolean() : null)
                    .build());
        });
        return members;
    }

    private static List<FileEntry> readFiles(JsonNode node) {
        if (!(node instanceof ArrayNode array)) {
            return null;
        }
        List<FileEntry> files = new ArrayList<>();
        array.forEach(element -> {
            if (!element.isObject() || !element.path("name").isTextual()) {
                return;
            }
            files.add(FileEntry.builder()
                    .name(element.get("name").asText())
                    .size(readScalar(element.get("size")))
                    .type(readScalar(element.get("type")))
                    .build());
        });
        return files;
    }
}
