package com.dropoutrisk.exception;

/**
 * Thrown when a student has no usable data in any risk domain.
 * Non-fatal: batch assessment reports it for that student and moves on.
 */
public class InsufficientDataException extends RiskEngineException {

    private final String studentId;

    public InsufficientDataException(String studentId) {
        super("No attendance, exam or fee data to assess for student: " + studentId);
        this.studentId = studentId;
    }

    public String getStudentId() {
        return studentId;
    }
}
