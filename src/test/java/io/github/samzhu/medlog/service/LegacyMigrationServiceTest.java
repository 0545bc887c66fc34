package io.github.samzhu.medlog.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.document.EventRecord;
import io.github.samzhu.medlog.document.LegacyLogRecord;
import io.github.samzhu.medlog.document.LegacyLogRecord.LegacyLog;
import io.github.samzhu.medlog.document.MedicineEvent;
import io.github.samzhu.medlog.document.MedicineType;
import io.github.samzhu.medlog.document.StoreSnapshot;
import io.github.samzhu.medlog.repository.JsonFileSnapshotStore;
import io.github.samzhu.medlog.repository.SnapshotStore;
import io.github.samzhu.medlog.repository.SnapshotTemplate;
import io.github.samzhu.medlog.repository.StoreUpdate;
import io.github.samzhu.medlog.service.LegacyMigrationService.MigrationResult;
import io.github.samzhu.medlog.util.StableEventIds;

class LegacyMigrationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant RECEIVED = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private Path dataFile;
    private SnapshotTemplate template;
    private LegacyMigrationService migrationService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        dataFile = tempDir.resolve("storage.json");
        template = templateFor(dataFile);
        migrationService = new LegacyMigrationService(template, clock, MedlogProperties.defaults());
    }

    @Test
    void shouldSplitLegacyLogIntoOneEventPerMedicineType() {
        // Given
        seedLog("ABC123", new LegacyLog("2026-01-15", 1, 2, null), RECEIVED);

        // When
        MigrationResult result = migrationService.migrate();

        // Then
        assertThat(result.createdEvents()).isEqualTo(2);
        List<EventRecord> events = events();
        assertThat(events).extracting(r -> r.event().type())
            .containsExactly(MedicineType.SPRAY, MedicineType.VENTOLINE);
        assertThat(events).extracting(r -> r.event().count()).containsExactly(1, 2);
        assertThat(events).allSatisfy(r -> {
            assertThat(r.code()).isEqualTo("ABC123");
            assertThat(r.event().date()).isEqualTo(LocalDate.of(2026, 1, 15));
            assertThat(r.event().timestamp()).isEqualTo("2026-01-15T12:00:00.000Z");
            assertThat(r.event().preventive()).isFalse();
            assertThat(r.receivedAt()).isEqualTo(RECEIVED);
        });
        assertThat(events.get(0).event().id())
            .isEqualTo(StableEventIds.derive("ABC123", LocalDate.of(2026, 1, 15), MedicineType.SPRAY));
    }

    @Test
    void shouldSkipMedicineTypesWithZeroCount() {
        // Given
        seedLog("ABC123", new LegacyLog("2026-01-15", 0, 3, null), RECEIVED);

        // When
        migrationService.migrate();

        // Then
        assertThat(events()).singleElement().satisfies(r -> {
            assertThat(r.event().type()).isEqualTo(MedicineType.VENTOLINE);
            assertThat(r.event().count()).isEqualTo(3);
        });
    }

    @Test
    void shouldMigrateLegacyLogWithUnpaddedDate() {
        // Given
        seedLog("ABC123", new LegacyLog("2026-1-5", 2, null, null), RECEIVED);

        // When
        MigrationResult result = migrationService.migrate();

        // Then: 事件使用正規化後的日期
        assertThat(result.createdEvents()).isEqualTo(1);
        assertThat(events()).singleElement().satisfies(r -> {
            assertThat(r.event().date()).isEqualTo(LocalDate.of(2026, 1, 5));
            assertThat(r.event().timestamp()).isEqualTo("2026-01-05T12:00:00.000Z");
            assertThat(r.event().id())
                .isEqualTo(StableEventIds.derive("ABC123", LocalDate.of(2026, 1, 5), MedicineType.SPRAY));
        });
    }

    @Test
    void shouldSkipLegacyLogWithUnparseableDateAndMigrateTheRest() {
        // Given
        seedLog("ABC123", new LegacyLog("15/01/2026", 1, null, null), RECEIVED);
        seedLog("ABC123", new LegacyLog("2026-01-16", 1, null, null), RECEIVED);

        // When
        MigrationResult result = migrationService.migrate();

        // Then: 無法解析的 log 原樣保留
        assertThat(result).isEqualTo(new MigrationResult(2, 1, 0, 1));
        assertThat(events()).extracting(r -> r.event().date()).containsExactly(LocalDate.of(2026, 1, 16));
        assertThat(template.read(StoreSnapshot::logs))
            .extracting(r -> r.log().date())
            .containsExactly("15/01/2026", "2026-01-16");
    }

    @Test
    void shouldBeIdempotentAcrossRuns() {
        // Given
        seedLog("ABC123", new LegacyLog("2026-01-15", 1, 2, null), RECEIVED);
        seedLog("XYZ789", new LegacyLog("2026-01-16", 4, null, null), RECEIVED);

        // When
        MigrationResult first = migrationService.migrate();
        List<EventRecord> afterFirst = events();
        MigrationResult second = migrationService.migrate();

        // Then
        assertThat(first.createdEvents()).isEqualTo(3);
        assertThat(second.createdEvents()).isZero();
        assertThat(second.skippedExisting()).isEqualTo(3);
        assertThat(events()).isEqualTo(afterFirst);
    }

    @Test
    void shouldMigrateOnlyNewLogsOnLaterRuns() {
        // Given
        seedLog("ABC123", new LegacyLog("2026-01-15", 1, null, null), RECEIVED);
        migrationService.migrate();

        // When: 舊版 client 又寫入一筆
        seedLog("ABC123", new LegacyLog("2026-01-16", 2, null, null), null);
        MigrationResult result = migrationService.migrate();

        // Then: 缺少 received_at 時使用目前時間
        assertThat(result.createdEvents()).isEqualTo(1);
        assertThat(events()).hasSize(2);
        assertThat(events().get(1).receivedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldProduceIdenticalIdsOnIndependentCopies() throws IOException {
        // Given
        seedLog("ABC123", new LegacyLog("2026-01-15", 1, 2, null), RECEIVED);
        Path copy = tempDir.resolve("copy.json");
        Files.copy(dataFile, copy);
        SnapshotTemplate copyTemplate = templateFor(copy);
        LegacyMigrationService copyService =
            new LegacyMigrationService(copyTemplate, clock, MedlogProperties.defaults());

        // When
        migrationService.migrate();
        copyService.migrate();

        // Then
        List<String> ids = events().stream().map(r -> r.event().id()).toList();
        List<String> copyIds = copyTemplate.read(StoreSnapshot::events).stream()
            .map(r -> r.event().id()).toList();
        assertThat(ids).hasSize(2).isEqualTo(copyIds);
    }

    @Test
    void shouldNotDuplicateEventAlreadyWrittenWithDerivedId() {
        // Given: 新版 client 已以相同決定性 ID 寫入事件
        LocalDate date = LocalDate.of(2026, 1, 15);
        seedLog("ABC123", new LegacyLog(date.toString(), 1, null, null), RECEIVED);
        String id = StableEventIds.derive("ABC123", date, MedicineType.SPRAY);
        template.update(snapshot -> {
            snapshot.events().add(new EventRecord("ABC123",
                new MedicineEvent(id, date, "2026-01-15T09:00:00.000Z", MedicineType.SPRAY, 1, false), RECEIVED));
            return StoreUpdate.write(null);
        });

        // When
        MigrationResult result = migrationService.migrate();

        // Then
        assertThat(result.createdEvents()).isZero();
        assertThat(result.skippedExisting()).isEqualTo(1);
        assertThat(events()).singleElement()
            .satisfies(r -> assertThat(r.event().timestamp()).isEqualTo("2026-01-15T09:00:00.000Z"));
    }

    @Test
    void shouldNotWriteWhenNothingToMigrate() {
        // Given
        SnapshotStore store = mock(SnapshotStore.class);
        when(store.read()).thenReturn(StoreSnapshot.empty());
        LegacyMigrationService service =
            new LegacyMigrationService(new SnapshotTemplate(store), clock, MedlogProperties.defaults());

        // When
        MigrationResult result = service.migrate();

        // Then
        assertThat(result).isEqualTo(new MigrationResult(0, 0, 0, 0));
        verify(store, never()).write(any());
    }

    @Test
    void shouldSwallowFailuresInScheduledRun() {
        // Given
        SnapshotStore store = mock(SnapshotStore.class);
        when(store.read()).thenThrow(new IllegalStateException("disk gone"));
        LegacyMigrationService service =
            new LegacyMigrationService(new SnapshotTemplate(store), clock, MedlogProperties.defaults());

        // When / Then: 排程執行只記錄錯誤，不拋出
        service.scheduledMigration();
        verify(store, never()).write(any());
    }

    private void seedLog(String code, LegacyLog log, Instant receivedAt) {
        template.update(snapshot -> {
            snapshot.logs().add(LegacyLogRecord.received(code, log, receivedAt));
            return StoreUpdate.write(null);
        });
    }

    private List<EventRecord> events() {
        return template.read(StoreSnapshot::events);
    }

    private static SnapshotTemplate templateFor(Path file) {
        return new SnapshotTemplate(new JsonFileSnapshotStore(new ObjectMapper(), file));
    }
}
