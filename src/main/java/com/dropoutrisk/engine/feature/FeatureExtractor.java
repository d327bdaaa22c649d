package com.dropoutrisk.engine.feature;

import com.dropoutrisk.exception.InsufficientDataException;
import com.dropoutrisk.model.RiskDomain;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Converts raw attendance, exam and fee records into a {@link FeatureVector}.
 *
 * MISSING DATA:
 * =============
 * A domain without records produces missing fields, not zeros. The rule engine
 * treats them as at least YELLOW and the predictor imputes them with training means.
 * Extraction only fails when all three domains are missing.
 */
@Slf4j
public class FeatureExtractor {

    private final FeatureSchema schema;
    private final int recentExamCount;
    private final int attemptCap;

    public FeatureExtractor(FeatureSchema schema, int recentExamCount, int attemptCap) {
        if (recentExamCount < 1) {
            throw new IllegalArgumentException("Recent exam count must be at least 1");
        }
        if (attemptCap < 0) {
            throw new IllegalArgumentException("Attempt cap cannot be negative");
        }
        this.schema = schema;
        this.recentExamCount = recentExamCount;
        this.attemptCap = attemptCap;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public FeatureVector extract(StudentRecords records) {
        return extract(records, ExtractionWindow.unbounded());
    }

    public FeatureVector extract(StudentRecords records, ExtractionWindow window) {
        FeatureVector.Builder builder = FeatureVector.builder(records.studentId(), schema);

        extractAttendance(records.attendance(), window, builder);
        extractAcademic(records.exams(), window, builder);
        extractFinancial(records.fees(), builder);

        FeatureVector vector = builder.build();
        boolean nothingToAssess = vector.isDomainMissing(RiskDomain.ATTENDANCE)
                && vector.isDomainMissing(RiskDomain.ACADEMIC)
                && vector.isDomainMissing(RiskDomain.FINANCIAL);
        if (nothingToAssess) {
            throw new InsufficientDataException(records.studentId());
        }

        log.debug("Extracted features for student {}: {}", records.studentId(), vector);
        return vector;
    }

    private void extractAttendance(List<AttendanceRecord> attendance, ExtractionWindow window,
                                   FeatureVector.Builder builder) {
        List<AttendanceRecord> marked = attendance.stream()
                .filter(r -> window.contains(r.date()))
                .toList();
        if (marked.isEmpty()) {
            return;
        }
        long present = marked.stream().filter(AttendanceRecord::present).count();
        put(builder, Feature.ATTENDANCE_PERCENTAGE, present * 100.0 / marked.size());
    }

    private void extractAcademic(List<ExamRecord> exams, ExtractionWindow window, FeatureVector.Builder builder) {
        List<ExamRecord> inWindow = exams.stream()
                .filter(e -> e.totalMarks() > 0)
                .filter(e -> window.contains(e.examDate()))
                .toList();
        if (inWindow.isEmpty()) {
            return;
        }

        // most recent first; ties broken by exam id then attempt so the selection is stable
        List<ExamRecord> recent = inWindow.stream()
                .sorted(Comparator.comparing(ExamRecord::examDate).reversed()
                        .thenComparing(ExamRecord::examId)
                        .thenComparing(ExamRecord::attempt, Comparator.reverseOrder()))
                .limit(recentExamCount)
                .toList();

        DescriptiveStatistics scores = new DescriptiveStatistics();
        recent.forEach(e -> scores.addValue(e.percentage()));
        long failed = recent.stream().filter(e -> !e.passed()).count();

        put(builder, Feature.AVERAGE_SCORE, scores.getMean());
        put(builder, Feature.SCORE_STD_DEV, Math.sqrt(scores.getPopulationVariance()));
        put(builder, Feature.FAILED_EXAM_COUNT, failed);
        put(builder, Feature.ATTEMPT_COUNT, Math.min(countRetakesAfterFailure(inWindow), attemptCap));
    }

    /**
     * Counts retake sittings that followed a failed sitting of the same exam.
     */
    private int countRetakesAfterFailure(List<ExamRecord> exams) {
        Map<String, List<ExamRecord>> byExam = exams.stream()
                .collect(Collectors.groupingBy(ExamRecord::examId));

        int retakes = 0;
        for (List<ExamRecord> sittings : byExam.values()) {
            List<ExamRecord> ordered = sittings.stream()
                    .sorted(Comparator.comparingInt(ExamRecord::attempt))
                    .toList();
            boolean failedBefore = false;
            for (ExamRecord sitting : ordered) {
                if (sitting.attempt() > 1 && failedBefore) {
                    retakes++;
                }
                failedBefore = failedBefore || !sitting.passed();
            }
        }
        return retakes;
    }

    private void extractFinancial(List<FeeRecord> fees, FeatureVector.Builder builder) {
        if (fees.isEmpty()) {
            return;
        }
        BigDecimal totalDue = BigDecimal.ZERO;
        BigDecimal totalOverdue = BigDecimal.ZERO;
        for (FeeRecord fee : fees) {
            totalDue = totalDue.add(fee.amountDue());
            totalOverdue = totalOverdue.add(fee.overdueAmount());
        }
        double ratio = totalDue.signum() == 0
                ? 0.0
                : totalOverdue.divide(totalDue, MathContext.DECIMAL64).doubleValue();
        put(builder, Feature.OVERDUE_FEES_RATIO, ratio);
    }

    private void put(FeatureVector.Builder builder, Feature feature, double value) {
        if (schema.indexOf(feature) >= 0) {
            builder.set(feature, value);
        }
    }
}
