package com.dropoutrisk.controller;

import com.dropoutrisk.engine.ml.EnsembleMember;
import com.dropoutrisk.engine.ml.LifecycleState;
import com.dropoutrisk.engine.ml.ModelArtifact;
import com.dropoutrisk.engine.ml.ModelRegistry;
import com.dropoutrisk.engine.ml.TrainingMetadata;
import com.dropoutrisk.engine.rule.ThresholdConfig;
import com.dropoutrisk.engine.rule.ThresholdConfigHolder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator endpoints: threshold hot reload and read-only model registry views.
 *
 * Model training is driven through Kafka ({@code model.training.requested}), never from here.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class ModelAdminController {

    private final ThresholdConfigHolder thresholdConfigHolder;
    private final ModelRegistry modelRegistry;

    @GetMapping("/thresholds")
    public ResponseEntity<ThresholdConfig> thresholds() {
        return ResponseEntity.ok(thresholdConfigHolder.current());
    }

    /**
     * PUT /api/admin/thresholds
     *
     * An invalid configuration is rejected with 400 and the current one keeps serving.
     * Assessments already running finish with the configuration they started with.
     */
    @PutMapping("/thresholds")
    public ResponseEntity<ThresholdConfig> reloadThresholds(@Valid @RequestBody ThresholdRequest request) {
        ThresholdConfig next = new ThresholdConfig(request.getVersion(),
                request.getAttendanceSafe(), request.getAttendanceWarning(),
                request.getScoreSafe(), request.getScoreWarning(),
                request.getFinancialWarningRatio(), request.getMaxAttempts());
        ThresholdConfig previous = thresholdConfigHolder.publish(next);
        log.info("Thresholds reloaded by operator: {} -> {}", previous.version(), next.version());
        return ResponseEntity.ok(next);
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelSummary>> models() {
        return ResponseEntity.ok(modelRegistry.all().stream().map(ModelSummary::of).toList());
    }

    @GetMapping("/models/active")
    public ResponseEntity<ModelSummary> activeModel() {
        return modelRegistry.active()
                .map(ModelSummary::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // ==================== DTOs ====================

    @Data
    public static class ThresholdRequest {
        @NotBlank(message = "Version is required")
        private String version;

        @NotNull(message = "Attendance safe threshold is required")
        private Double attendanceSafe;

        @NotNull(message = "Attendance warning threshold is required")
        private Double attendanceWarning;

        @NotNull(message = "Score safe threshold is required")
        private Double scoreSafe;

        @NotNull(message = "Score warning threshold is required")
        private Double scoreWarning;

        @NotNull(message = "Financial warning ratio is required")
        private Double financialWarningRatio;

        @NotNull(message = "Max attempts is required")
        private Integer maxAttempts;
    }

    /**
     * Registry view without the ensemble internals.
     */
    public record ModelSummary(
        String version,
        LifecycleState state,
        String featureSchemaVersion,
        List<String> members,
        TrainingMetadata metadata
    ) {
        static ModelSummary of(ModelArtifact artifact) {
            return new ModelSummary(artifact.version(), artifact.state(), artifact.featureSchemaVersion(),
                    artifact.members().stream().map(EnsembleMember::name).toList(), artifact.metadata());
        }
    }
}
