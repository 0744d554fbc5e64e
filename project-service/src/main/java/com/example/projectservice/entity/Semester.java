package com.example.projectservice.entity;

import java.util.Arrays;

/**
 * Academic semester, stored as "1" or "2".
 */
public enum Semester {
    FIRST("1"),
    SECOND("2");

    private final String value;

    Semester(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public String getLabel() {
        return "Semester " + value;
    }

    public static Semester fromValue(String value) {
        return Arrays.stream(values())
                .filter(semester -> semester.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown semester: " + value));
    }
}
