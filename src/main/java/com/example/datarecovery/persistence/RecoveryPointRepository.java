package com.example.datarecovery.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for recovery point rows.
 */
@Repository
public interface RecoveryPointRepository extends JpaRepository<RecoveryPointEntity, Long> {

    /**
     * All recovery points, newest first. Points created in the same instant are ordered by id.
     */
    List<RecoveryPointEntity> findAllByOrderByTimestampDescIdDesc();
}
