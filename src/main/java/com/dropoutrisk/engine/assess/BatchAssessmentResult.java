package com.dropoutrisk.engine.assess;

import java.util.List;

/**
 * Outcome of a batch run: successful assessments and per-student failures, both in input order.
 */
public record BatchAssessmentResult(List<RiskAssessment> assessments, List<AssessmentFailure> failures) {

    public BatchAssessmentResult {
        assessments = List.copyOf(assessments);
        failures = List.copyOf(failures);
    }

    public int total() {
        return assessments.size() + failures.size();
    }
}
