package com.example.datarecovery.persistence;

import com.example.datarecovery.exception.InvalidStateException;
import com.example.datarecovery.exception.NotFoundException;
import com.example.datarecovery.model.RecoveryData;
import com.example.datarecovery.model.RecoveryPoint;
import com.example.datarecovery.model.RecoveryPointStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent catalog of recovery points and their encrypted payloads.
 * The only owner of both row types: points and data are created, and deleted, together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecoveryCatalog {

    private final RecoveryPointRepository pointRepository;
    private final RecoveryDataRepository dataRepository;

    // ==================== Recovery Points ====================

    /**
     * Persist a new recovery point. Any id on the argument is ignored.
     *
     * @return the catalog-assigned id
     */
    @Transactional
    public Long addPoint(RecoveryPoint point) {
        RecoveryPointEntity entity = new RecoveryPointEntity(
            null,  // id will be auto-generated
            point.getTimestamp(),
            point.getKind(),
            point.getTrigger(),
            point.getDescription(),
            point.getSizeBytes(),
            point.getChecksum(),
            point.getStatus(),
            point.getMetadata()
        );

        Long id = pointRepository.save(entity).getId();
        log.debug("Added recovery point {}: status={}, size={} bytes", id, point.getStatus(), point.getSizeBytes());
        return id;
    }

    /**
     * Move a PENDING point to its final status.
     *
     * @throws NotFoundException if the point does not exist
     * @throws InvalidStateException if the point already reached a terminal status
     */
    @Transactional
    public void updatePointStatus(Long id, RecoveryPointStatus status) {
        RecoveryPointEntity entity = pointRepository.findById(id)
            .orElseThrow(() -> new NotFoundException("recovery point", id));

        if (entity.getStatus().isTerminal()) {
            throw new InvalidStateException(String.format(
                "Recovery point %d is already %s and cannot become %s", id, entity.getStatus(), status));
        }

        entity.setStatus(status);
        pointRepository.save(entity);
        log.debug("Recovery point {} is now {}", id, status);
    }

    @Transactional(readOnly = true)
    public Optional<RecoveryPoint> getPoint(Long id) {
        return pointRepository.findById(id).map(RecoveryCatalog::toPoint);
    }

    /**
     * All recovery points, newest first.
     */
    @Transactional(readOnly = true)
    public List<RecoveryPoint> listPoints() {
        return pointRepository.findAllByOrderByTimestampDescIdDesc()
            .stream()
            .map(RecoveryCatalog::toPoint)
            .toList();
    }

    public long countPoints() {
        return pointRepository.count();
    }

    // ==================== Recovery Data ====================

    /**
     * Store the encrypted payload of an existing point. A point holds at most one payload.
     */
    @Transactional
    public void addData(Long recoveryPointId, byte[] payload, Instant timestamp) {
        if (!pointRepository.existsById(recoveryPointId)) {
            throw new NotFoundException("recovery point", recoveryPointId);
        }
        if (dataRepository.existsByRecoveryPointId(recoveryPointId)) {
            throw new InvalidStateException("Recovery point " + recoveryPointId + " already has recovery data");
        }

        dataRepository.save(new RecoveryDataEntity(null, recoveryPointId, payload, timestamp));
        log.debug("Stored {} bytes of recovery data for point {}", payload.length, recoveryPointId);
    }

    @Transactional(readOnly = true)
    public Optional<RecoveryData> getData(Long recoveryPointId) {
        return dataRepository.findByRecoveryPointId(recoveryPointId)
            .map(e -> new RecoveryData(e.getRecoveryPointId(), e.getPayload(), e.getTimestamp()));
    }

    // ==================== Deletion ====================

    /**
     * Delete a point and its data in one transaction: both go, or neither does.
     *
     * @return false if no such point exists
     */
    @Transactional
    public boolean deletePoint(Long id) {
        if (!pointRepository.existsById(id)) {
            return false;
        }

        int dataRows = dataRepository.deleteByRecoveryPointId(id);
        pointRepository.deleteById(id);

        log.info("Deleted recovery point {} ({} data row(s))", id, dataRows);
        return true;
    }

    private static RecoveryPoint toPoint(RecoveryPointEntity entity) {
        return RecoveryPoint.builder()
            .id(entity.getId())
            .timestamp(entity.getTimestamp())
            .kind(entity.getKind())
            .trigger(entity.getTrigger())
            .description(entity.getDescription())
            .sizeBytes(entity.getSizeBytes())
            .checksum(entity.getChecksum())
            .status(entity.getStatus())
            .metadata(entity.getMetadata())
            .build();
    }
}
