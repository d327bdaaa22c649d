package com.dropoutrisk.engine;

import com.dropoutrisk.engine.feature.AttendanceRecord;
import com.dropoutrisk.engine.feature.ExamRecord;
import com.dropoutrisk.engine.feature.FeeRecord;
import com.dropoutrisk.engine.feature.StudentRecords;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Record builders shared by the engine tests.
 */
public final class StudentFixtures {

    public static final LocalDate TERM_START = LocalDate.of(2024, 1, 8);

    private StudentFixtures() {
    }

    /**
     * {@code total} daily sessions starting at {@link #TERM_START}, the first {@code present} attended.
     */
    public static List<AttendanceRecord> attendance(int present, int total) {
        List<AttendanceRecord> records = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            records.add(new AttendanceRecord(TERM_START.plusDays(i), "MATH", i < present));
        }
        return records;
    }

    /**
     * First sitting of an exam out of 100 marks with a pass mark of 40.
     */
    public static ExamRecord exam(String examId, LocalDate date, double marks) {
        return new ExamRecord(examId, "MATH", date, marks, 100.0, 40.0, 1);
    }

    public static ExamRecord retake(String examId, LocalDate date, double marks, int attempt) {
        return new ExamRecord(examId, "MATH", date, marks, 100.0, 40.0, attempt);
    }

    /**
     * Exams on consecutive weeks all scoring {@code marks}.
     */
    public static List<ExamRecord> exams(int count, double marks) {
        List<ExamRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(exam("EX-" + i, TERM_START.plusWeeks(i), marks));
        }
        return records;
    }

    public static FeeRecord fee(String due, String paid, boolean overdue) {
        return new FeeRecord("TUITION", new BigDecimal(due), new BigDecimal(paid), TERM_START, overdue);
    }

    /**
     * A student with 20 sessions, four exams and one 1000 tuition fee, shaped to the given
     * attendance percentage, exam score and overdue ratio.
     */
    public static StudentRecords student(String studentId, int attendancePercentage, double score,
                                         double overdueRatio) {
        int present = attendancePercentage * 20 / 100;
        BigDecimal due = new BigDecimal("1000");
        BigDecimal unpaid = due.multiply(BigDecimal.valueOf(overdueRatio));
        FeeRecord fee = new FeeRecord("TUITION", due, due.subtract(unpaid), TERM_START, unpaid.signum() > 0);
        return new StudentRecords(studentId, attendance(present, 20), exams(4, score), List.of(fee));
    }
}
