package com.dropoutrisk.repository;

import com.dropoutrisk.model.AssessmentRecord;
import com.dropoutrisk.model.Tier;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AssessmentRecordRepository extends JpaRepository<AssessmentRecord, Long> {

    /**
     * Latest assessment for a student; insertion order breaks ties on identical timestamps.
     */
    Optional<AssessmentRecord> findTopByStudentIdOrderByAssessedAtDescIdDesc(String studentId);

    /**
     * A student's assessments, newest first.
     */
    List<AssessmentRecord> findByStudentIdOrderByAssessedAtDescIdDesc(String studentId, Pageable pageable);

    long countByFinalOverallTier(Tier finalOverallTier);

    long countByAssessedAtGreaterThanEqual(Instant since);

    /**
     * Latest assessment of every student whose latest final tier is one of {@code tiers},
     * most recently assessed first.
     */
    @Query("SELECT r FROM AssessmentRecord r " +
           "WHERE r.finalOverallTier IN :tiers " +
           "AND NOT EXISTS (SELECT 1 FROM AssessmentRecord later " +
           "                WHERE later.studentId = r.studentId " +
           "                AND (later.assessedAt > r.assessedAt " +
           "                     OR (later.assessedAt = r.assessedAt AND later.id > r.id))) " +
           "ORDER BY r.assessedAt DESC, r.id DESC")
    List<AssessmentRecord> findLatestWithFinalTierIn(@Param("tiers") Collection<Tier> tiers, Pageable pageable);
}
