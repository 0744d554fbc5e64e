package com.example.projectservice.dto.request;

import com.example.projectservice.metadata.TeamMemberEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Team member as submitted. Role is "student" or "lecturer"; other entries are dropped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamMemberRequest {

    private String id;
    private String name;
    private String email;
    private String role;

    @JsonProperty("isPrimary")
    private Boolean primary;

    public TeamMemberEntry toEntry() {
        return TeamMemberEntry.builder()
                .id(id)
                .name(name)
                .email(email)
                .role(role)
                .primary(primary)
                .build();
    }
}
