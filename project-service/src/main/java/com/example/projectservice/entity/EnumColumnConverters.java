package com.example.projectservice.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Converters mapping the lowercase enum-like columns of the store.
 */
public final class EnumColumnConverters {

    private EnumColumnConverters() {
    }

    @Converter
    public static class ProjectStatusConverter implements AttributeConverter<ProjectStatus, String> {
        @Override
        public String convertToDatabaseColumn(ProjectStatus attribute) {
            return attribute != null ? attribute.getValue() : null;
        }

        @Override
        public ProjectStatus convertToEntityAttribute(String dbData) {
            return dbData != null ? ProjectStatus.fromValue(dbData) : null;
        }
    }

    @Converter
    public static class ProjectTypeConverter implements AttributeConverter<ProjectType, String> {
        @Override
        public String convertToDatabaseColumn(ProjectType attribute) {
            return attribute != null ? attribute.getValue() : null;
        }

        @Override
        public ProjectType convertToEntityAttribute(String dbData) {
            return dbData != null ? ProjectType.fromValue(dbData) : null;
        }
    }

    @Converter
    public static class SemesterConverter implements AttributeConverter<Semester, String> {
        @Override
        public String convertToDatabaseColumn(Semester attribute) {
            return attribute != null ? attribute.getValue() : null;
        }

        @Override
        public Semester convertToEntityAttribute(String dbData) {
            return dbData != null ? Semester.fromValue(dbData) : null;
        }
    }

    @Converter
    public static class UserRoleConverter implements AttributeConverter<UserRole, String> {
        @Override
        public String convertToDatabaseColumn(UserRole attribute) {
            return attribute != null ? attribute.getValue() : null;
        }

        @Override
        public UserRole convertToEntityAttribute(String dbData) {
            return dbData != null ? UserRole.fromValue(dbData) : null;
        }
    }
}
