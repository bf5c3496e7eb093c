package com.example.datarecovery.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for encrypted snapshot payloads.
 */
@Repository
public interface RecoveryDataRepository extends JpaRepository<RecoveryDataEntity, Long> {

    Optional<RecoveryDataEntity> findByRecoveryPointId(Long recoveryPointId);

    boolean existsByRecoveryPointId(Long recoveryPointId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RecoveryDataEntity d WHERE d.recoveryPointId = ?1")
    int deleteByRecoveryPointId(Long recoveryPointId);
}
