package com.example.projectservice.entity;

import java.util.Arrays;

/**
 * Kind of project. Stored lowercase in {@code project.project_type}.
 */
public enum ProjectType {
    ACADEMIC("academic", "Capstone"),
    COMPETITION("competition", "Competition Work"),
    SERVICE("service", "Social Service"),
    OTHER("other", "Other");

    private final String value;
    private final String displayName;

    ProjectType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static ProjectType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown project type: " + value));
    }
}
