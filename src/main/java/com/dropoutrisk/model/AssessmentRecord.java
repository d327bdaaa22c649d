package com.dropoutrisk.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only row for one stored assessment.
 *
 * Rows are never updated; a correction is a new assessment. The full verdict
 * (recommendations and member probabilities included) is kept as JSON next to
 * the columns used for querying.
 */
@Entity
@Immutable
@Table(name = "risk_assessments",
       indexes = {
           @Index(name = "idx_student_assessed", columnList = "studentId, assessedAt")
       })
@Data
@NoArgsConstructor
public class AssessmentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String assessmentId;

    @Column(nullable = false)
    private String studentId;

    @Column(nullable = false)
    private Instant assessedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Tier ruleOverallTier;

    @Enumerated(EnumType.STRING)
    private Tier mlTier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Tier finalOverallTier;

    private Double dropoutProbability;

    private Double confidence;

    private String modelVersion;

    @Column(nullable = false)
    private String thresholdVersion;

    @Column(nullable = false)
    private String featureSchemaVersion;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;
}
