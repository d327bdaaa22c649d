package com.dropoutrisk.engine.training;

import com.dropoutrisk.engine.feature.StudentRecords;

/**
 * Historical student records with the known outcome.
 */
public record LabeledExample(StudentRecords records, boolean droppedOut) {

    public LabeledExample {
        if (records == null) {
            throw new IllegalArgumentException("Student records cannot be null");
        }
    }
}
