package io.github.samzhu.medlog.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.document.EventRecord;
import io.github.samzhu.medlog.document.LegacyLogRecord;
import io.github.samzhu.medlog.document.MedicineEvent;
import io.github.samzhu.medlog.document.MedicineType;
import io.github.samzhu.medlog.repository.SnapshotTemplate;
import io.github.samzhu.medlog.repository.StoreUpdate;
import io.github.samzhu.medlog.util.CodeMasking;
import io.github.samzhu.medlog.util.StableEventIds;

/**
 * 舊版 log → 事件遷移服務。
 *
 * <p>每筆舊版 log 依藥物類型轉為 0～2 筆事件（只轉換次數大於 0 的類型）。
 * 遷移可任意重複執行，也可與即時事件寫入交錯，不會產生重複事件，
 * 輸入不變時結果一致。處理流程：
 * <ol>
 *   <li>讀取整份快照；沒有舊版 log 時直接結束</li>
 *   <li>收集所有既有事件 ID（跨所有代碼）作為去重集合</li>
 *   <li>解析 log 日期；缺少或格式錯誤的 log 記錄警告後略過，不影響其他 log</li>
 *   <li>對每筆 log 的每個類型推導決定性 ID（{@link StableEventIds}），已存在則略過</li>
 *   <li>新事件一次性附加並只寫入一次；沒有新事件則不寫入</li>
 * </ol>
 *
 * <p>舊版 log 沒有時間點，遷移事件一律使用當日 12:00:00.000Z。
 * 這是刻意保留的簡化，下游可能已依賴此值，不應「修正」。
 *
 * <p>觸發方式：
 * <ul>
 *   <li>管理端點手動觸發（例外會傳回呼叫端）</li>
 *   <li>依 {@code medlog.migration.cron} 定時執行，轉換舊版 client 期間新寫入的 log</li>
 *   <li>{@code medlog.migration.run-on-startup} 為 true 時於啟動完成後執行一次</li>
 * </ul>
 */
@Service
public class LegacyMigrationService {

    private static final Logger log = LoggerFactory.getLogger(LegacyMigrationService.class);

    static final String MIDDAY_UTC_SUFFIX = "T12:00:00.000Z";

    private final SnapshotTemplate template;
    private final Clock clock;
    private final boolean runOnStartup;

    public LegacyMigrationService(SnapshotTemplate template, Clock clock, MedlogProperties properties) {
        this.template = template;
        this.clock = clock;
        this.runOnStartup = properties.migration().runOnStartup();
    }

    /**
     * 執行一次遷移。
     *
     * @return 遷移結果統計
     */
    public MigrationResult migrate() {
        long startTime = System.currentTimeMillis();

        MigrationResult result = template.update(snapshot -> {
            if (snapshot.logs().isEmpty()) {
                return StoreUpdate.unchanged(MigrationResult.EMPTY);
            }

            Set<String> knownIds = new HashSet<>();
            for (EventRecord record : snapshot.events()) {
                knownIds.add(record.event().id());
            }

            List<EventRecord> created = new ArrayList<>();
            int skippedExisting = 0;
            int skippedInvalid = 0;
            for (LegacyLogRecord legacy : snapshot.logs()) {
                Optional<LocalDate> date = legacy.log() == null || legacy.code() == null
                    ? Optional.empty()
                    : legacy.log().parsedDate();
                if (date.isEmpty()) {
                    log.warn("Skipping legacy log with missing code or unparseable date: code={}, date={}",
                        CodeMasking.mask(legacy.code()), legacy.log() == null ? null : legacy.log().date());
                    skippedInvalid++;
                    continue;
                }
                for (MedicineType type : MedicineType.values()) {
                    int count = legacy.log().countFor(type);
                    if (count <= 0) {
                        continue;
                    }
                    String id = StableEventIds.derive(legacy.code(), date.get(), type);
                    if (!knownIds.add(id)) {
                        skippedExisting++;
                        continue;
                    }
                    created.add(toEventRecord(legacy, date.get(), id, type, count));
                }
            }

            MigrationResult outcome = new MigrationResult(
                snapshot.logs().size(), created.size(), skippedExisting, skippedInvalid);
            if (created.isEmpty()) {
                return StoreUpdate.unchanged(outcome);
            }
            snapshot.events().addAll(created);
            return StoreUpdate.write(outcome);
        });

        long duration = System.currentTimeMillis() - startTime;
        log.info("Legacy migration completed: {} logs examined, {} events created, {} already migrated, "
            + "{} invalid in {}ms",
            result.legacyLogs(), result.createdEvents(), result.skippedExisting(), result.skippedInvalid(), duration);
        return result;
    }

    /**
     * 定時遷移，Cron 由 {@code medlog.migration.cron} 設定（預設每小時整點，{@code "-"} 停用）。
     *
     * <p>失敗只記錄，等待下一次排程。
     */
    @Scheduled(cron = "${medlog.migration.cron:0 0 * * * *}")
    public void scheduledMigration() {
        log.debug("Scheduled legacy migration triggered");
        runSafely("scheduled");
    }

    /**
     * 啟動完成後執行一次遷移。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void migrateOnStartup() {
        if (!runOnStartup) {
            log.debug("Startup legacy migration disabled");
            return;
        }
        runSafely("startup");
    }

    private void runSafely(String trigger) {
        try {
            migrate();
        } catch (RuntimeException e) {
            log.error("Legacy migration ({}) failed, will retry on next run: {}", trigger, e.getMessage(), e);
        }
    }

    private EventRecord toEventRecord(LegacyLogRecord legacy, LocalDate date, String id, MedicineType type,
            int count) {
        MedicineEvent event = new MedicineEvent(
            id,
            date,
            date + MIDDAY_UTC_SUFFIX,
            type,
            count,
            false
        );
        Instant receivedAt = legacy.receivedAt() != null ? legacy.receivedAt() : clock.instant();
        return new EventRecord(legacy.code(), event, receivedAt);
    }

    /**
     * 遷移結果。
     *
     * @param legacyLogs 檢查的舊版 log 數
     * @param createdEvents 本次新建的事件數
     * @param skippedExisting 因 ID 已存在而略過的數量
     * @param skippedInvalid 因日期無法解析而略過的 log 數
     */
    public record MigrationResult(
        @JsonProperty("legacy_logs") int legacyLogs,
        @JsonProperty("created_events") int createdEvents,
        @JsonProperty("skipped_existing") int skippedExisting,
        @JsonProperty("skipped_invalid") int skippedInvalid
    ) {
        static final MigrationResult EMPTY = new MigrationResult(0, 0, 0, 0);
    }
}
