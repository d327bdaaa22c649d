package com.dropoutrisk.engine.feature;

import com.dropoutrisk.model.RiskDomain;

/**
 * Numeric features the extractor can produce, each belonging to one risk domain.
 */
public enum Feature {
    ATTENDANCE_PERCENTAGE("attendance_percentage", RiskDomain.ATTENDANCE),
    AVERAGE_SCORE("average_score", RiskDomain.ACADEMIC),
    SCORE_STD_DEV("score_std_dev", RiskDomain.ACADEMIC),
    FAILED_EXAM_COUNT("failed_exam_count", RiskDomain.ACADEMIC),
    OVERDUE_FEES_RATIO("overdue_fees_ratio", RiskDomain.FINANCIAL),
    ATTEMPT_COUNT("attempt_count", RiskDomain.ACADEMIC);

    private final String fieldName;
    private final RiskDomain domain;

    Feature(String fieldName, RiskDomain domain) {
        this.fieldName = fieldName;
        this.domain = domain;
    }

    public String fieldName() {
        return fieldName;
    }

    public RiskDomain domain() {
        return domain;
    }
}
