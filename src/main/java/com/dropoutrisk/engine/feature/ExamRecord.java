package com.dropoutrisk.engine.feature;

import java.time.LocalDate;

/**
 * One exam sitting. {@code attempt} is 1 for the first sitting and increases with each retake.
 */
public record ExamRecord(
    String examId,
    String subject,
    LocalDate examDate,
    double marksObtained,
    double totalMarks,
    double passingMarks,
    int attempt
) {
    public ExamRecord {
        if (examId == null || examId.isBlank()) {
            throw new IllegalArgumentException("Exam ID cannot be null or empty");
        }
        if (examDate == null) {
            throw new IllegalArgumentException("Exam date cannot be null");
        }
        if (attempt < 1) {
            attempt = 1;
        }
    }

    public double percentage() {
        return totalMarks > 0 ? marksObtained / totalMarks * 100.0 : 0.0;
    }

    public boolean passed() {
        return marksObtained >= passingMarks;
    }
}
