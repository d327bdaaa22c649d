package com.dropoutrisk.model;

/**
 * Independent risk dimensions assessed by the rule engine.
 */
public enum RiskDomain {
    ATTENDANCE,
    ACADEMIC,
    FINANCIAL
}
