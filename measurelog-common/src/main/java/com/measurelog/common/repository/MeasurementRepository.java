package com.measurelog.common.repository;

import com.measurelog.common.entity.Measurement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MeasurementRepository extends JpaRepository<Measurement, Long> {

    List<Measurement> findByLogIdOrderByIdAsc(Long logId);

    /**
     * Per-status row counts for one log, as {status, count} pairs.
     */
    @Query("SELECT m.embeddingStatus, COUNT(m) FROM Measurement m " +
            "WHERE m.logId = :logId GROUP BY m.embeddingStatus")
    List<Object[]> countByEmbeddingStatus(@Param("logId") Long logId);

    // Rows whose embedding was never written, whatever their status says
    @Query("SELECT m.id FROM Measurement m WHERE m.logId = :logId AND m.embedding IS NULL ORDER BY m.id")
    List<Long> findUnembeddedIds(@Param("logId") Long logId);
}
