package com.example.projectservice.entity;

import java.util.Arrays;

/**
 * Review status of a project.
 * Stored lowercase in the {@code project.status} column.
 *
 * Transitions: draft → underreview → {approved, reject}.
 * Any status may be moved back into underreview; approved and reject
 * are only reachable from underreview.
 */
public enum ProjectStatus {
    DRAFT("draft", "Draft"),
    UNDERREVIEW("underreview", "Under Review"),
    APPROVED("approved", "Approved"),
    REJECT("reject", "Rejected");

    private final String value;
    private final String displayName;

    ProjectStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(ProjectStatus target) {
        if (target == null) {
            return false;
        }
        return switch (target) {
            case UNDERREVIEW -> true;
            case APPROVED, REJECT -> this == UNDERREVIEW || this == target;
            case DRAFT -> this == DRAFT;
        };
    }

    public static ProjectStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown project status: " + value));
    }
}
