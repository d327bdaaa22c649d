package com.dropoutrisk.service;

import com.dropoutrisk.config.KafkaTopics;
import com.dropoutrisk.engine.assess.BatchAssessmentResult;
import com.dropoutrisk.engine.assess.RiskAssessment;
import com.dropoutrisk.engine.assess.RiskAssessor;
import com.dropoutrisk.engine.assess.RiskChangeDetector;
import com.dropoutrisk.engine.feature.StudentRecords;
import com.dropoutrisk.engine.rule.ThresholdConfig;
import com.dropoutrisk.engine.rule.ThresholdConfigHolder;
import com.dropoutrisk.event.RiskAssessmentCompleted;
import com.dropoutrisk.event.RiskTierChanged;
import com.dropoutrisk.exception.RiskEngineException;
import com.dropoutrisk.model.AssessmentRecord;
import com.dropoutrisk.model.RiskSummary;
import com.dropoutrisk.model.Tier;
import com.dropoutrisk.repository.AssessmentRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs assessments and owns every side effect around them.
 *
 * FLOW (one transaction):
 * =======================
 * 1. Snapshot the current thresholds and take the assessment time from the clock
 * 2. Let the engine produce the verdict (pure, no I/O)
 * 3. Read the student's previous final tier (Redis cache, database on miss)
 * 4. Append the assessment row
 * 5. Write RiskAssessmentCompleted, and RiskTierChanged if the tier moved, to the outbox
 * 6. Refresh the cached latest tier (applied on commit)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentService {

    private static final Duration RECENT_WINDOW = Duration.ofDays(30);

    private final RiskAssessor riskAssessor;
    private final RiskChangeDetector riskChangeDetector;
    private final ThresholdConfigHolder thresholdConfigHolder;
    private final AssessmentRecordRepository assessmentRecordRepository;
    private final AssessmentHistoryService assessmentHistoryService;
    private final OutboxWriter outboxWriter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Assesses and stores one student.
     *
     * @param requestId correlation id carried on the completion event
     */
    @Transactional
    public RiskAssessment assess(StudentRecords records, String requestId) {
        log.info("Assessing student {} (request {})", records.studentId(), requestId);

        ThresholdConfig thresholds = thresholdConfigHolder.current();
        RiskAssessment assessment = riskAssessor.assess(records, thresholds, clock.instant());

        Tier previous = AssessmentHistoryService.toTier(
                assessmentHistoryService.latestFinalTier(records.studentId()));
        store(assessment, previous, requestId);
        return assessment;
    }

    /**
     * Assesses a batch against one threshold and model snapshot. Students that cannot be
     * assessed are reported as failures; everyone else is stored.
     */
    @Transactional
    public BatchAssessmentResult assessBatch(List<StudentRecords> students, String requestId) {
        Instant assessedAt = clock.instant();
        BatchAssessmentResult result = riskAssessor.assessBatch(students, thresholdConfigHolder.current(), assessedAt);

        // the cache is only refreshed on commit, so repeats inside one batch are tracked here
        Map<String, Tier> seenInBatch = new HashMap<>();
        for (RiskAssessment assessment : result.assessments()) {
            String studentId = assessment.studentId();
            Tier previous = seenInBatch.containsKey(studentId)
                    ? seenInBatch.get(studentId)
                    : AssessmentHistoryService.toTier(assessmentHistoryService.latestFinalTier(studentId));
            store(assessment, previous, requestId);
            seenInBatch.put(studentId, assessment.finalOverallTier());
        }

        log.info("Batch {} stored {} assessments, {} failures",
                requestId, result.assessments().size(), result.failures().size());
        return result;
    }

    @Transactional(readOnly = true)
    public Optional<RiskAssessment> latest(String studentId) {
        return assessmentRecordRepository.findTopByStudentIdOrderByAssessedAtDescIdDesc(studentId)
                .map(this::readPayload);
    }

    /**
     * A student's stored assessments, newest first.
     */
    @Transactional(readOnly = true)
    public List<RiskAssessment> history(String studentId, int limit) {
        return assessmentRecordRepository
                .findByStudentIdOrderByAssessedAtDescIdDesc(studentId, PageRequest.of(0, limit))
                .stream()
                .map(this::readPayload)
                .toList();
    }

    /**
     * Stored assessments by final tier, plus how many were made in the last 30 days.
     */
    @Transactional(readOnly = true)
    public RiskSummary summary() {
        Map<Tier, Long> distribution = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            distribution.put(tier, assessmentRecordRepository.countByFinalOverallTier(tier));
        }
        long recent = assessmentRecordRepository.countByAssessedAtGreaterThanEqual(
                clock.instant().minus(RECENT_WINDOW));
        return new RiskSummary(assessmentRecordRepository.count(), distribution.get(Tier.GREEN),
                distribution.get(Tier.YELLOW), distribution.get(Tier.RED), recent,
                Collections.unmodifiableMap(distribution));
    }

    /**
     * Latest verdicts of students currently at YELLOW or RED, most recently assessed first.
     */
    @Transactional(readOnly = true)
    public List<RiskAssessment> highRisk(int limit) {
        return assessmentRecordRepository
                .findLatestWithFinalTierIn(EnumSet.of(Tier.YELLOW, Tier.RED), PageRequest.of(0, limit))
                .stream()
                .map(this::readPayload)
                .toList();
    }

    private void store(RiskAssessment assessment, Tier previousFinalTier, String requestId) {
        String assessmentId = UUID.randomUUID().toString();
        assessmentRecordRepository.save(toRecord(assessmentId, assessment));

        outboxWriter.write(new RiskAssessmentCompleted(assessmentId, requestId, assessment, assessment.assessedAt()),
                assessmentId, assessment.studentId(), KafkaTopics.RISK_ASSESSMENT_COMPLETED);

        Optional<RiskTierChanged> change = riskChangeDetector.detect(previousFinalTier, assessment);
        change.ifPresent(event -> {
            log.info("Risk tier changed for student {}: {} -> {}",
                    event.studentId(), event.previousFinalTier(), event.newFinalTier());
            outboxWriter.write(event, assessmentId, assessment.studentId(), KafkaTopics.RISK_TIER_CHANGED);
        });

        assessmentHistoryService.recordLatestFinalTier(assessment.studentId(), assessment.finalOverallTier());

        log.info("Stored assessment {} for student {}: rule={} ml={} final={} (model {}, thresholds {})",
                assessmentId, assessment.studentId(), assessment.ruleOverallTier(), assessment.mlTier(),
                assessment.finalOverallTier(),
                assessment.isRuleOnly() ? "none" : assessment.modelVersion(), assessment.thresholdVersion());
    }

    private AssessmentRecord toRecord(String assessmentId, RiskAssessment assessment) {
        AssessmentRecord record = new AssessmentRecord();
        record.setAssessmentId(assessmentId);
        record.setStudentId(assessment.studentId());
        record.setAssessedAt(assessment.assessedAt());
        record.setRuleOverallTier(assessment.ruleOverallTier());
        record.setMlTier(assessment.mlTier());
        record.setFinalOverallTier(assessment.finalOverallTier());
        record.setDropoutProbability(assessment.dropoutProbability());
        record.setConfidence(assessment.confidence());
        record.setModelVersion(assessment.modelVersion());
        record.setThresholdVersion(assessment.thresholdVersion());
        record.setFeatureSchemaVersion(assessment.featureSchemaVersion());
        try {
            record.setPayload(objectMapper.writeValueAsString(assessment));
        } catch (JsonProcessingException e) {
            throw new RiskEngineException("Failed to serialize assessment for student " + assessment.studentId(), e);
        }
        return record;
    }

    private RiskAssessment readPayload(AssessmentRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), RiskAssessment.class);
        } catch (JsonProcessingException e) {
            throw new RiskEngineException("Stored assessment " + record.getAssessmentId() + " is unreadable", e);
        }
    }
}
