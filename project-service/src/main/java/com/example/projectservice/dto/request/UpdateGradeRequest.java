package com.example.projectservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grade letter (A, B+, B, C+, C, D+, D, F). Null or blank clears the grade.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateGradeRequest {

    private String grade;
}
