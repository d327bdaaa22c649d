package com.dropoutrisk.controller;

import com.dropoutrisk.engine.assess.BatchAssessmentResult;
import com.dropoutrisk.engine.assess.RiskAssessment;
import com.dropoutrisk.engine.feature.StudentRecords;
import com.dropoutrisk.model.RiskSummary;
import com.dropoutrisk.service.AssessmentService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Synchronous assessment endpoints for counselor tools and back-office jobs.
 * Results are stored and published exactly as for Kafka-triggered assessments.
 */
@RestController
@RequestMapping("/api/assessments")
@Validated
@RequiredArgsConstructor
@Slf4j
public class AssessmentController {

    private final AssessmentService assessmentService;

    /**
     * POST /api/assessments
     */
    @PostMapping
    public ResponseEntity<RiskAssessment> assess(@Valid @RequestBody AssessmentRequest request) {
        log.info("Received assessment request for student: {}", request.getRecords().studentId());
        RiskAssessment assessment = assessmentService.assess(request.getRecords(), requestIdOf(request.getRequestId()));
        return ResponseEntity.ok(assessment);
    }

    /**
     * POST /api/assessments/batch
     *
     * Students without any data come back under {@code failures}; the rest are assessed.
     */
    @PostMapping("/batch")
    public ResponseEntity<BatchAssessmentResult> assessBatch(@Valid @RequestBody BatchAssessmentRequest request) {
        log.info("Received batch assessment request for {} students", request.getStudents().size());
        return ResponseEntity.ok(assessmentService.assessBatch(request.getStudents(), requestIdOf(request.getRequestId())));
    }

    /**
     * GET /api/assessments/{studentId}/latest
     */
    @GetMapping("/{studentId}/latest")
    public ResponseEntity<RiskAssessment> latest(@PathVariable String studentId) {
        return assessmentService.latest(studentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/assessments/{studentId}/history?limit=10
     *
     * Newest first; an unknown student gets an empty list.
     */
    @GetMapping("/{studentId}/history")
    public ResponseEntity<List<RiskAssessment>> history(
            @PathVariable String studentId,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(assessmentService.history(studentId, limit));
    }

    /**
     * GET /api/assessments/summary
     */
    @GetMapping("/summary")
    public ResponseEntity<RiskSummary> summary() {
        return ResponseEntity.ok(assessmentService.summary());
    }

    /**
     * GET /api/assessments/high-risk?limit=50
     *
     * Students whose latest verdict is YELLOW or RED, one entry per student.
     */
    @GetMapping("/high-risk")
    public ResponseEntity<List<RiskAssessment>> highRisk(
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit) {
        return ResponseEntity.ok(assessmentService.highRisk(limit));
    }

    private static String requestIdOf(String supplied) {
        return supplied == null || supplied.isBlank() ? UUID.randomUUID().toString() : supplied;
    }

    // ==================== DTOs ====================

    @Data
    public static class AssessmentRequest {
        private String requestId;

        @NotNull(message = "Student records are required")
        private StudentRecords records;
    }

    @Data
    public static class BatchAssessmentRequest {
        private String requestId;

        @NotEmpty(message = "At least one student is required")
        private List<@NotNull StudentRecords> students;
    }
}
