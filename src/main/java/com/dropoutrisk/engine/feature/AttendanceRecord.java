package com.dropoutrisk.engine.feature;

import java.time.LocalDate;

/**
 * One marked attendance session for a student.
 */
public record AttendanceRecord(
    LocalDate date,
    String subject,
    boolean present
) {
    public AttendanceRecord {
        if (date == null) {
            throw new IllegalArgumentException("Attendance date cannot be null");
        }
    }
}
