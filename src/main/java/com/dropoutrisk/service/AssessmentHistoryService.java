package com.dropoutrisk.service;

import com.dropoutrisk.config.RedisConfig;
import com.dropoutrisk.model.Tier;
import com.dropoutrisk.repository.AssessmentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Latest final tier per student, cached in Redis.
 *
 * Assessments are append-only, so the latest tier only changes when a new assessment is
 * stored; {@link #recordLatestFinalTier} refreshes the entry at that moment. Students with no
 * history are not cached (null results are skipped).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentHistoryService {

    private final AssessmentRecordRepository assessmentRecordRepository;

    /**
     * @return tier name of the latest assessment, or null for a student never assessed
     */
    @Cacheable(value = RedisConfig.LATEST_TIERS_CACHE, key = "#studentId", unless = "#result == null")
    public String latestFinalTier(String studentId) {
        log.debug("Cache miss - loading latest tier from database: {}", studentId);
        return assessmentRecordRepository.findTopByStudentIdOrderByAssessedAtDescIdDesc(studentId)
                .map(record -> record.getFinalOverallTier().name())
                .orElse(null);
    }

    @CachePut(value = RedisConfig.LATEST_TIERS_CACHE, key = "#studentId")
    public String recordLatestFinalTier(String studentId, Tier tier) {
        return tier.name();
    }

    public static Tier toTier(String cached) {
        return cached == null ? null : Tier.valueOf(cached);
    }
}
