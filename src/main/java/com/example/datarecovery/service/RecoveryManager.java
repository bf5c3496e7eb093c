package com.example.datarecovery.service;

import com.example.datarecovery.audit.AuditActorResolver;
import com.example.datarecovery.audit.AuditEvent;
import com.example.datarecovery.audit.AuditSink;
import com.example.datarecovery.codec.IntegrityCodec;
import com.example.datarecovery.config.RecoveryConfig;
import com.example.datarecovery.exception.IntegrityException;
import com.example.datarecovery.exception.InvalidStateException;
import com.example.datarecovery.exception.NotFoundException;
import com.example.datarecovery.exception.RestoreException;
import com.example.datarecovery.exception.SnapshotException;
import com.example.datarecovery.exception.ValidationException;
import com.example.datarecovery.model.CollectionValidationResult;
import com.example.datarecovery.model.RecoveryData;
import com.example.datarecovery.model.RecoveryMetadata;
import com.example.datarecovery.model.RecoveryPoint;
import com.example.datarecovery.model.RecoveryPointKind;
import com.example.datarecovery.model.RecoveryPointStatus;
import com.example.datarecovery.model.RecoveryRestoredEvent;
import com.example.datarecovery.model.RecoveryTrigger;
import com.example.datarecovery.model.RestoreOptions;
import com.example.datarecovery.model.RestoreResult;
import com.example.datarecovery.persistence.RecoveryCatalog;
import com.example.datarecovery.store.CollectionStore;
import com.example.datarecovery.store.StoreCollection;
import com.example.datarecovery.validation.SchemaValidationResult;
import com.example.datarecovery.validation.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Creates encrypted, checksummed snapshots of the record store and restores the store from them.
 * <p>
 * What each failure means for the live store:
 * <ul>
 *   <li>{@link NotFoundException}, {@link InvalidStateException}, {@link IntegrityException}
 *       and {@link ValidationException}: raised before any mutation, store untouched.</li>
 *   <li>{@link SnapshotException}: only the catalog was written (a FAILED point), store untouched.</li>
 *   <li>{@link RestoreException}: the safety snapshot failed before any mutation, or the write-back
 *       transaction failed and was rolled back. Store unchanged either way.</li>
 * </ul>
 * Calls block on store and catalog I/O. No lock is held across a whole call; snapshot
 * reads are not isolated from concurrent writers of other collections.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecoveryManager {

    public static final String PRE_RESTORE_DESCRIPTION = "automatic pre-restore snapshot";

    static final String AUDIT_RESOURCE = "recovery";
    static final String ACTION_CREATE = "create_recovery_point";
    static final String ACTION_RESTORE = "restore_from_point";
    static final String ACTION_DELETE = "delete_recovery_point";
    static final String ACTION_PRUNE = "prune_recovery_points";

    private final CollectionStore store;
    private final RecoveryCatalog catalog;
    private final IntegrityCodec codec;
    private final SchemaValidator schemaValidator;
    private final AuditSink auditSink;
    private final AuditActorResolver actorResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final RecoveryConfig config;
    private final Clock clock;

    // ==================== Snapshot creation ====================

    public RecoveryPoint createSnapshot(String description) {
        return createSnapshot(description, RecoveryTrigger.MANUAL);
    }

    /**
     * Snapshot every collection of the store.
     *
     * @return the COMPLETED point
     * @throws SnapshotException on any failure; if the point had been persisted it is marked FAILED
     */
    public RecoveryPoint createSnapshot(String description, RecoveryTrigger trigger) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(trigger, "trigger");

        Long pointId = null;
        try {
            List<StoreCollection> collections = store.listCollections();

            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            List<String> collectionNames = new ArrayList<>(collections.size());
            Map<String, Integer> recordCounts = new LinkedHashMap<>();
            for (StoreCollection collection : collections) {
                List<JsonNode> records = store.readAll(collection);
                payload.putArray(collection.collectionName()).addAll(records);
                collectionNames.add(collection.collectionName());
                recordCounts.put(collection.collectionName(), records.size());
            }

            byte[] canonical = codec.canonicalBytes(payload);

            RecoveryPoint point = RecoveryPoint.builder()
                .timestamp(clock.instant())
                .kind(RecoveryPointKind.FULL)
                .trigger(trigger)
                .description(description)
                .sizeBytes(canonical.length)
                .checksum(codec.checksum(canonical))
                .status(RecoveryPointStatus.PENDING)
                .metadata(new RecoveryMetadata(config.getSchemaVersion(), collectionNames, recordCounts))
                .build();

            pointId = catalog.addPoint(point);
            point.setId(pointId);

            byte[] ciphertext = codec.encrypt(canonical);
            catalog.addData(pointId, ciphertext, laterOf(clock.instant(), point.getTimestamp()));

            catalog.updatePointStatus(pointId, RecoveryPointStatus.COMPLETED);
            point.setStatus(RecoveryPointStatus.COMPLETED);

            log.info("Created recovery point {} ({}): {} collection(s), {} bytes, checksum={}",
                pointId, trigger, collections.size(), canonical.length, point.getChecksum());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("recoveryPointId", pointId);
            details.put("type", trigger.name().toLowerCase());
            details.put("description", description);
            recordAudit(ACTION_CREATE, details);

            return point;
        } catch (RuntimeException e) {
            throw snapshotFailed(pointId, e);
        }
    }

    private SnapshotException snapshotFailed(Long pointId, RuntimeException cause) {
        if (pointId == null) {
            log.error("Failed to create recovery point: {}", cause.getMessage(), cause);
            return new SnapshotException("Failed to create recovery point: " + cause.getMessage(), null, cause);
        }

        try {
            catalog.updatePointStatus(pointId, RecoveryPointStatus.FAILED);
        } catch (RuntimeException statusFailure) {
            cause.addSuppressed(statusFailure);
            log.error("Could not mark recovery point {} as FAILED", pointId, statusFailure);
        }
        log.error("Failed to create recovery point {}: {}", pointId, cause.getMessage(), cause);
        return new SnapshotException(
            "Failed to create recovery point " + pointId + ": " + cause.getMessage(), pointId, cause);
    }

    // ==================== Restore ====================

    /**
     * Restore the store, or a subset of its collections, to a completed recovery point.
     * <p>
     * Verification and validation happen first; then an AUTOMATIC safety snapshot is taken;
     * then all target collections are rewritten in one store transaction.
     */
    public RestoreResult restoreFromPoint(Long recoveryPointId, RestoreOptions options) {
        RestoreOptions opts = options != null ? options : RestoreOptions.defaults();

        RecoveryPoint point = requireRestorable(recoveryPointId);
        Map<StoreCollection, List<JsonNode>> snapshot = readVerifiedPayload(point);
        Set<StoreCollection> targets = resolveTargets(recoveryPointId, snapshot, opts);

        if (opts.isValidate()) {
            Map<StoreCollection, List<String>> failures = new EnumMap<>(StoreCollection.class);
            for (CollectionValidationResult result : validate(snapshot)) {
                if (!result.isValid()) {
                    failures.put(result.getCollection(), result.getErrors());
                }
            }
            if (!failures.isEmpty()) {
                log.warn("Restore of recovery point {} rejected: validation failed for {}",
                    recoveryPointId, failures.keySet());
                throw new ValidationException(failures);
            }
        }

        RecoveryPoint safetySnapshot;
        try {
            safetySnapshot = createSnapshot(PRE_RESTORE_DESCRIPTION, RecoveryTrigger.AUTOMATIC);
        } catch (SnapshotException e) {
            throw new RestoreException(
                "Pre-restore snapshot failed, restore of recovery point " + recoveryPointId + " aborted", e);
        }

        Set<StoreCollection> preserved = EnumSet.noneOf(StoreCollection.class);
        if (opts.isPreserveAuditTrail() && targets.contains(StoreCollection.AUDIT_LOGS)) {
            preserved.add(StoreCollection.AUDIT_LOGS);
        }

        // Filled in before commit; nothing after the commit reads from the store.
        Map<StoreCollection, Long> counts = new EnumMap<>(StoreCollection.class);
        try {
            store.withTransaction(targets, () -> {
                for (StoreCollection collection : targets) {
                    if (preserved.contains(collection)) {
                        counts.put(collection, store.count(collection));
                        continue;
                    }
                    store.clear(collection);
                    store.bulkInsert(collection, snapshot.get(collection));
                    counts.put(collection, (long) snapshot.get(collection).size());
                }
            });
        } catch (RuntimeException e) {
            log.error("Restore of recovery point {} rolled back: {}", recoveryPointId, e.getMessage(), e);
            throw new RestoreException(
                "Failed to restore from recovery point " + recoveryPointId + ": " + e.getMessage(), e);
        }

        Instant restoredAt = clock.instant();

        log.info("Restored recovery point {} into {} (preserved {}), pre-restore snapshot {}",
            recoveryPointId, targets, preserved, safetySnapshot.getId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recoveryPointId", recoveryPointId);
        details.put("preRestoreSnapshotId", safetySnapshot.getId());
        details.put("options", describe(opts));
        recordAudit(ACTION_RESTORE, details);

        if (opts.isNotifyUsers()) {
            publishRestored(new RecoveryRestoredEvent(
                recoveryPointId, safetySnapshot.getId(), Collections.unmodifiableSet(targets), restoredAt));
        }

        return RestoreResult.builder()
            .recoveryPointId(recoveryPointId)
            .restoredCollections(Collections.unmodifiableSet(targets))
            .preservedCollections(Collections.unmodifiableSet(preserved))
            .preRestoreSnapshotId(safetySnapshot.getId())
            .recordCounts(counts)
            .timestamp(restoredAt)
            .build();
    }

    // ==================== Catalog management ====================

    /**
     * All recovery points, newest first, including FAILED ones kept for diagnosis.
     */
    public List<RecoveryPoint> listRecoveryPoints() {
        return catalog.listPoints();
    }

    /**
     * Delete a recovery point together with its data.
     *
     * @throws NotFoundException if no such point exists
     */
    public void deleteRecoveryPoint(Long recoveryPointId) {
        if (!catalog.deletePoint(recoveryPointId)) {
            throw new NotFoundException("recovery point", recoveryPointId);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recoveryPointId", recoveryPointId);
        recordAudit(ACTION_DELETE, details);
    }

    /**
     * Keep the newest {@code retain} recovery points and delete the rest.
     * PENDING points belong to snapshots still in progress and are never pruned.
     *
     * @return number of points deleted
     */
    public int pruneRecoveryPoints(int retain) {
        if (retain < 0) {
            throw new IllegalArgumentException("retain must not be negative: " + retain);
        }

        if (catalog.countPoints() <= retain) {
            return 0;
        }

        List<RecoveryPoint> points = catalog.listPoints();
        List<Long> removed = new ArrayList<>();
        for (RecoveryPoint point : points.subList(Math.min(retain, points.size()), points.size())) {
            if (point.getStatus() == RecoveryPointStatus.PENDING) {
                continue;
            }
            if (catalog.deletePoint(point.getId())) {
                removed.add(point.getId());
            }
        }

        if (!removed.isEmpty()) {
            log.info("Pruned {} recovery point(s), retaining the newest {}", removed.size(), retain);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("retain", retain);
            details.put("deletedRecoveryPointIds", removed);
            recordAudit(ACTION_PRUNE, details);
        }
        return removed.size();
    }

    /**
     * Decrypt and verify a completed recovery point, then validate every collection in it.
     * Never touches the live store.
     */
    public List<CollectionValidationResult> validateRecoveryPoint(Long recoveryPointId) {
        RecoveryPoint point = requireRestorable(recoveryPointId);
        return validate(readVerifiedPayload(point));
    }

    // ==================== Helpers ====================

    private RecoveryPoint requireRestorable(Long recoveryPointId) {
        RecoveryPoint point = catalog.getPoint(recoveryPointId)
            .orElseThrow(() -> new NotFoundException("recovery point", recoveryPointId));

        if (!point.isRestorable()) {
            throw new InvalidStateException(String.format(
                "Recovery point %d is %s; only COMPLETED points can be used", recoveryPointId, point.getStatus()));
        }
        return point;
    }

    /**
     * Decrypt the point's data and check it against the stored checksum and record counts.
     */
    private Map<StoreCollection, List<JsonNode>> readVerifiedPayload(RecoveryPoint point) {
        Long id = point.getId();
        RecoveryData data = catalog.getData(id).orElseThrow(() -> {
            log.error("Catalog inconsistency: COMPLETED recovery point {} has no recovery data", id);
            return new NotFoundException("recovery data", id);
        });

        JsonNode payload = codec.parse(codec.decrypt(data.getPayload()));

        String actual = codec.checksum(payload);
        if (!actual.equals(point.getChecksum())) {
            log.error("Integrity check failed for recovery point {}: expected checksum {}, got {}",
                id, point.getChecksum(), actual);
            throw new IntegrityException("Data integrity check failed for recovery point " + id);
        }
        if (!payload.isObject()) {
            throw new IntegrityException("Recovery point " + id + " does not hold a collection mapping");
        }

        Map<StoreCollection, List<JsonNode>> snapshot = new EnumMap<>(StoreCollection.class);
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            StoreCollection collection = StoreCollection.fromName(field.getKey())
                .orElseThrow(() -> new InvalidStateException(
                    "Recovery point " + id + " contains unknown collection '" + field.getKey() + "'"));
            if (!field.getValue().isArray()) {
                throw new IntegrityException(
                    "Collection " + field.getKey() + " of recovery point " + id + " is not an array");
            }
            List<JsonNode> records = new ArrayList<>(field.getValue().size());
            field.getValue().forEach(records::add);
            snapshot.put(collection, records);
        }

        Map<String, Integer> expectedCounts = point.getMetadata().getRecordCounts();
        Map<String, Integer> actualCounts = new LinkedHashMap<>();
        snapshot.forEach((collection, records) -> actualCounts.put(collection.collectionName(), records.size()));
        if (!actualCounts.equals(expectedCounts)) {
            log.error("Record counts of recovery point {} do not match its metadata: expected {}, got {}",
                id, expectedCounts, actualCounts);
            throw new IntegrityException("Record counts of recovery point " + id + " do not match its metadata");
        }

        if (!Objects.equals(point.getMetadata().getSchemaVersion(), config.getSchemaVersion())) {
            log.warn("Recovery point {} was taken under schema version {}, current version is {}",
                id, point.getMetadata().getSchemaVersion(), config.getSchemaVersion());
        }
        return snapshot;
    }

    private static Set<StoreCollection> resolveTargets(Long recoveryPointId,
                                                       Map<StoreCollection, List<JsonNode>> snapshot,
                                                       RestoreOptions options) {
        if (options.getCollections() == null || options.getCollections().isEmpty()) {
            return snapshot.isEmpty() ? EnumSet.noneOf(StoreCollection.class) : EnumSet.copyOf(snapshot.keySet());
        }

        for (StoreCollection requested : options.getCollections()) {
            if (!snapshot.containsKey(requested)) {
                throw new NotFoundException(
                    "collection " + requested.collectionName() + " in recovery point", recoveryPointId);
            }
        }
        return EnumSet.copyOf(options.getCollections());
    }

    private List<CollectionValidationResult> validate(Map<StoreCollection, List<JsonNode>> snapshot) {
        List<CollectionValidationResult> results = new ArrayList<>(snapshot.size());
        for (Map.Entry<StoreCollection, List<JsonNode>> entry : snapshot.entrySet()) {
            List<String> errors = new ArrayList<>();
            List<JsonNode> records = entry.getValue();
            for (int i = 0; i < records.size(); i++) {
                SchemaValidationResult result = schemaValidator.validate(entry.getKey(), records.get(i));
                if (!result.isSuccess()) {
                    for (String error : result.getErrors()) {
                        errors.add("record " + i + ": " + error);
                    }
                }
            }
            results.add(new CollectionValidationResult(entry.getKey(), errors.isEmpty(), errors));
        }
        return results;
    }

    private static Map<String, Object> describe(RestoreOptions options) {
        Map<String, Object> described = new LinkedHashMap<>();
        described.put("collections", options.getCollections() == null
            ? null
            : options.getCollections().stream().map(StoreCollection::collectionName).sorted().toList());
        described.put("validate", options.isValidate());
        described.put("preserveAuditTrail", options.isPreserveAuditTrail());
        described.put("notifyUsers", options.isNotifyUsers());
        return described;
    }

    private void recordAudit(String action, Map<String, Object> details) {
        if (!config.isAuditEnabled()) {
            return;
        }

        // Never throws: the audited operation has already taken effect.
        try {
            AuditEvent event = AuditEvent.builder()
                .timestamp(clock.instant())
                .userId(actorResolver.currentActor())
                .action(action)
                .resource(AUDIT_RESOURCE)
                .details(details)
                .ip(AuditEvent.INTERNAL_IP)
                .userAgent(AuditEvent.SYSTEM_USER_AGENT)
                .build();
            auditSink.logAudit(event);
        } catch (RuntimeException e) {
            log.error("Audit event {} on {} not recorded, details={}", action, AUDIT_RESOURCE, details, e);
        }
    }

    private void publishRestored(RecoveryRestoredEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Restore of recovery point {} committed but listener notification failed: {}",
                event.getRecoveryPointId(), e.getMessage(), e);
        }
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
