package com.example.datarecovery.persistence;

import com.example.datarecovery.exception.InvalidStateException;
import com.example.datarecovery.exception.NotFoundException;
import com.example.datarecovery.model.RecoveryData;
import com.example.datarecovery.model.RecoveryMetadata;
import com.example.datarecovery.model.RecoveryPoint;
import com.example.datarecovery.model.RecoveryPointKind;
import com.example.datarecovery.model.RecoveryPointStatus;
import com.example.datarecovery.model.RecoveryTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.Mockito.*;

/**
 * Integration tests for RecoveryCatalog.
 * Tests ordering, status transitions and atomic deletion of points with their data.
 */
@SpringBootTest
class RecoveryCatalogTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    private RecoveryCatalog catalog;

    @Autowired
    private RecoveryPointRepository pointRepository;

    @Autowired
    private RecoveryDataRepository dataRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        dataRepository.deleteAll();
        pointRepository.deleteAll();
    }

    @Test
    void testAddAndGetPoint() {
        Long id = catalog.addPoint(point(T0, "nightly"));

        RecoveryPoint stored = catalog.getPoint(id).orElseThrow();

        assertEquals(id, stored.getId());
        assertEquals(T0, stored.getTimestamp());
        assertEquals(RecoveryPointKind.FULL, stored.getKind());
        assertEquals(RecoveryTrigger.MANUAL, stored.getTrigger());
        assertEquals("nightly", stored.getDescription());
        assertEquals(RecoveryPointStatus.PENDING, stored.getStatus());
        assertEquals("1.0", stored.getMetadata().getSchemaVersion());
        assertEquals(List.of("users", "jobs"), stored.getMetadata().getCollections());
        assertEquals(Map.of("users", 2, "jobs", 0), stored.getMetadata().getRecordCounts());
    }

    @Test
    void testLongDescriptionIsStored() {
        String description = "before the quarterly migration: ".repeat(200);

        Long id = catalog.addPoint(point(T0, description));

        assertEquals(description, catalog.getPoint(id).orElseThrow().getDescription());
    }

    @Test
    void testGetUnknownPoint() {
        assertTrue(catalog.getPoint(424242L).isEmpty());
        assertTrue(catalog.getData(424242L).isEmpty());
    }

    @Test
    void testListPointsNewestFirst() {
        Long middle = catalog.addPoint(point(T0.plusSeconds(60), "middle"));
        Long oldest = catalog.addPoint(point(T0, "oldest"));
        Long newest = catalog.addPoint(point(T0.plusSeconds(120), "newest"));
        Long newestTwin = catalog.addPoint(point(T0.plusSeconds(120), "newest twin"));

        List<Long> ids = catalog.listPoints().stream().map(RecoveryPoint::getId).toList();

        assertEquals(List.of(newestTwin, newest, middle, oldest), ids);
        assertEquals(4, catalog.countPoints());
    }

    @Test
    void testStatusTransitions() {
        Long completed = catalog.addPoint(point(T0, "a"));
        Long failed = catalog.addPoint(point(T0, "b"));

        catalog.updatePointStatus(completed, RecoveryPointStatus.COMPLETED);
        catalog.updatePointStatus(failed, RecoveryPointStatus.FAILED);

        assertTrue(catalog.getPoint(completed).orElseThrow().isRestorable());
        assertFalse(catalog.getPoint(failed).orElseThrow().isRestorable());
        assertThrows(InvalidStateException.class,
            () -> catalog.updatePointStatus(completed, RecoveryPointStatus.FAILED));
        assertThrows(InvalidStateException.class,
            () -> catalog.updatePointStatus(failed, RecoveryPointStatus.COMPLETED));
        assertThrows(NotFoundException.class,
            () -> catalog.updatePointStatus(424242L, RecoveryPointStatus.COMPLETED));
    }

    @Test
    void testAddAndGetData() {
        Long id = catalog.addPoint(point(T0, "nightly"));
        byte[] payload = {1, 2, 3, 4};

        catalog.addData(id, payload, T0.plusMillis(5));

        RecoveryData data = catalog.getData(id).orElseThrow();
        assertEquals(id, data.getRecoveryPointId());
        assertArrayEquals(payload, data.getPayload());
        assertEquals(T0.plusMillis(5), data.getTimestamp());
    }

    @Test
    void testDataRequiresExistingPointAndIsWrittenOnce() {
        Long id = catalog.addPoint(point(T0, "nightly"));
        catalog.addData(id, new byte[]{1}, T0);

        assertThrows(NotFoundException.class, () -> catalog.addData(424242L, new byte[]{1}, T0));
        assertThrows(InvalidStateException.class, () -> catalog.addData(id, new byte[]{2}, T0));
        assertArrayEquals(new byte[]{1}, catalog.getData(id).orElseThrow().getPayload());
    }

    @Test
    void testDeletePointRemovesData() {
        Long id = catalog.addPoint(point(T0, "nightly"));
        Long other = catalog.addPoint(point(T0, "other"));
        catalog.addData(id, new byte[]{1}, T0);
        catalog.addData(other, new byte[]{2}, T0);

        assertTrue(catalog.deletePoint(id));

        assertTrue(catalog.getPoint(id).isEmpty());
        assertTrue(catalog.getData(id).isEmpty());
        assertTrue(catalog.getData(other).isPresent());
        assertFalse(catalog.deletePoint(id));
    }

    @Test
    void testDeleteIsAtomicWhenPointRemovalFails() {
        Long id = catalog.addPoint(point(T0, "nightly"));
        catalog.addData(id, new byte[]{1, 2, 3}, T0);

        RecoveryPointRepository failingPoints = mock(RecoveryPointRepository.class, delegatesTo(pointRepository));
        doThrow(new IllegalStateException("disk full")).when(failingPoints).deleteById(id);
        RecoveryCatalog failingCatalog = new RecoveryCatalog(failingPoints, dataRepository);

        assertThrows(IllegalStateException.class,
            () -> transactionTemplate.executeWithoutResult(status -> failingCatalog.deletePoint(id)));

        assertTrue(pointRepository.existsById(id));
        assertTrue(dataRepository.existsByRecoveryPointId(id));
        assertArrayEquals(new byte[]{1, 2, 3}, catalog.getData(id).orElseThrow().getPayload());
    }

    private static RecoveryPoint point(Instant timestamp, String description) {
        return RecoveryPoint.builder()
            .timestamp(timestamp)
            .kind(RecoveryPointKind.FULL)
            .trigger(RecoveryTrigger.MANUAL)
            .description(description)
            .sizeBytes(128)
            .checksum("0".repeat(64))
            .status(RecoveryPointStatus.PENDING)
            .metadata(new RecoveryMetadata("1.0", List.of("users", "jobs"), Map.of("users", 2, "jobs", 0)))
            .build();
    }
}
