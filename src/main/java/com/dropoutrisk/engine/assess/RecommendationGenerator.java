package com.dropoutrisk.engine.assess;

import com.dropoutrisk.engine.feature.Feature;
import com.dropoutrisk.engine.feature.FeatureVector;
import com.dropoutrisk.engine.ml.Prediction;
import com.dropoutrisk.engine.rule.RuleEvaluation;
import com.dropoutrisk.model.Tier;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns an assessment into actionable steps for mentors and counselors.
 */
public class RecommendationGenerator {

    public List<String> generate(FeatureVector vector, RuleEvaluation rules, Prediction prediction) {
        List<String> recommendations = new ArrayList<>();

        if (rules.attendanceTier() != Tier.GREEN) {
            OptionalDouble attendance = vector.value(Feature.ATTENDANCE_PERCENTAGE);
            if (attendance.isEmpty()) {
                recommendations.add("No attendance recorded; confirm attendance tracking for this student");
            } else if (attendance.getAsDouble() < 60) {
                recommendations.add("Immediate intervention required for attendance");
            } else if (attendance.getAsDouble() < 75) {
                recommendations.add("Schedule meeting with student and parents about attendance");
            }
            recommendations.add("Implement attendance tracking and early warning system");
        }

        if (rules.academicTier() != Tier.GREEN) {
            OptionalDouble score = vector.value(Feature.AVERAGE_SCORE);
            if (score.isEmpty()) {
                recommendations.add("No exam results recorded; confirm academic records for this student");
            } else if (score.getAsDouble() < 40) {
                recommendations.add("Urgent academic support needed");
            } else if (score.getAsDouble() < 60) {
                recommendations.add("Schedule extra classes and academic counseling");
            }
            recommendations.add("Assign peer mentor for academic support");
        }

        if (rules.financialTier() != Tier.GREEN) {
            OptionalDouble overdue = vector.value(Feature.OVERDUE_FEES_RATIO);
            if (overdue.isPresent() && overdue.getAsDouble() > 0.5) {
                recommendations.add("Immediate financial counseling required");
            } else if (overdue.isPresent() && overdue.getAsDouble() > 0.2) {
                recommendations.add("Schedule fee payment discussion");
            }
            recommendations.add("Explore financial aid and payment plan options");
        }

        if (prediction != null) {
            if (prediction.probability() > 0.7) {
                recommendations.add("High dropout risk - implement comprehensive intervention plan");
            } else if (prediction.probability() > 0.5) {
                recommendations.add("Moderate dropout risk - monitor closely and provide support");
            }
        }

        if (rules.overallTier() == Tier.RED) {
            recommendations.add("Schedule comprehensive counseling session");
            recommendations.add("Involve parents/guardians in intervention plan");
            recommendations.add("Weekly progress monitoring required");
        }
        return recommendations;
    }
}
