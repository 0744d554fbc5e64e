package com.example.projectservice.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Free-form attribute bag stored in {@code project.comment_student}.
 *
 * Known keys are typed; any other key found in a stored payload is carried
 * through untouched in {@link #additional} so that re-encoding never loses data.
 * Serialization is done by {@link ProjectMetadataCodec} only.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProjectMetadata {

    private List<String> keywords;
    private List<String> externalLinks;
    private List<TeamMemberEntry> teamMembers;
    private String award;
    private String courseCode;
    private String completionDate;
    private List<FileEntry> files;
    private String grade;

    @Builder.Default
    private Map<String, JsonNode> additional = new TreeMap<>();

    /**
     * True when the bag has no keys at all.
     */
    public boolean isEmpty() {
        return keywords == null
                && externalLinks == null
                && teamMembers == null
                && award == null
                && courseCode == null
                && completionDate == null
                && files == null
                && grade == null
                && (additional == null || additional.isEmpty());
    }
}
