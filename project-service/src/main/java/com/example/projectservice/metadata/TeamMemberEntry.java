package com.example.projectservice.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Denormalized team member snapshot kept in the metadata bag.
 * Lecturer entries are kept here too; they are the advisor candidates.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "email", "role", "isPrimary"})
public class TeamMemberEntry {

    public static final String ROLE_STUDENT = "student";
    public static final String ROLE_LECTURER = "lecturer";

    private String id;
    private String name;
    private String email;
    private String role;

    @JsonProperty("isPrimary")
    private Boolean primary;

    @JsonIgnore
    public boolean isStudent() {
        return ROLE_STUDENT.equals(role);
    }

    @JsonIgnore
    public boolean isLecturer() {
        return ROLE_LECTURER.equals(role);
    }

    @JsonIgnore
    public boolean isPrimaryMember() {
        return Boolean.TRUE.equals(primary);
    }
}
