package com.purchasingpower.codelod.repository;

import com.purchasingpower.codelod.model.DescriptionRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DescriptionRecordRepository extends JpaRepository<DescriptionRecordEntity, String> {

    /**
     * All records flagged stale.
     */
    List<DescriptionRecordEntity> findByStaleTrueOrderByFingerprintAsc();

    List<DescriptionRecordEntity> findAllByOrderByFingerprintAsc();

    /**
     * Flips the stale flag without touching the description text.
     */
    @Modifying
    @Query("UPDATE DescriptionRecordEntity d SET d.stale = :stale, d.updatedAt = :now WHERE d.fingerprint = :fingerprint")
    int updateStale(@Param("fingerprint") String fingerprint,
                    @Param("stale") boolean stale,
                    @Param("now") Instant now);
}
