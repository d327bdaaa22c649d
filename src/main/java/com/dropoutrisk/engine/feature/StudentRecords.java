package com.dropoutrisk.engine.feature;

import java.util.List;

/**
 * All raw records for one student, as supplied by the import/persistence layer.
 * Records are expected to be validated and deduplicated upstream.
 */
public record StudentRecords(
    String studentId,
    List<AttendanceRecord> attendance,
    List<ExamRecord> exams,
    List<FeeRecord> fees
) {
    public StudentRecords {
        if (studentId == null || studentId.isBlank()) {
            throw new IllegalArgumentException("Student ID cannot be null or empty");
        }
        attendance = attendance == null ? List.of() : List.copyOf(attendance);
        exams = exams == null ? List.of() : List.copyOf(exams);
        fees = fees == null ? List.of() : List.copyOf(fees);
    }
}
