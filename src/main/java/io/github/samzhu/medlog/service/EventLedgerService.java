package io.github.samzhu.medlog.service;

import java.time.Clock;
import java.util.List;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.medlog.document.EventRecord;
import io.github.samzhu.medlog.document.LegacyLogRecord;
import io.github.samzhu.medlog.document.LegacyLogRecord.LegacyLog;
import io.github.samzhu.medlog.document.MedicineEvent;
import io.github.samzhu.medlog.document.UsageRecord;
import io.github.samzhu.medlog.dto.EventEntry;
import io.github.samzhu.medlog.dto.LegacyLogEntry;
import io.github.samzhu.medlog.repository.SnapshotTemplate;
import io.github.samzhu.medlog.repository.StoreUpdate;
import io.github.samzhu.medlog.util.CodeMasking;

/**
 * 用藥事件帳本服務。
 *
 * <p>以用戶代碼為單位新增與查詢事件：
 * <ul>
 *   <li>新增時依 {@code (code, event.id)} 去重，重送相同事件回傳 {@link AppendOutcome#SKIPPED}，不是錯誤</li>
 *   <li>查詢依儲存順序回傳，不依日期或時間重新排序（呈現順序由呼叫端決定）</li>
 *   <li>未知代碼或沒有事件的代碼回傳空清單</li>
 * </ul>
 *
 * <p>另保留舊版 log 的寫入與讀取路徑，供尚未更新的 client 使用；
 * 舊版 log 由 {@link LegacyMigrationService} 轉換為事件。
 *
 * <p>去重為線性掃描，在目前資料量下足夠；資料量放大時應改為以
 * {@code (code, event.id)} 為鍵的索引。
 */
@Service
public class EventLedgerService {

    private static final Logger log = LoggerFactory.getLogger(EventLedgerService.class);

    private final SnapshotTemplate template;
    private final Clock clock;

    public EventLedgerService(SnapshotTemplate template, Clock clock) {
        this.template = template;
        this.clock = clock;
    }

    /**
     * 新增用藥事件（冪等）。
     *
     * @param code 用戶代碼
     * @param event 已驗證的事件
     * @return 新增成功為 {@link AppendOutcome#INSERTED}，已存在為 {@link AppendOutcome#SKIPPED}
     */
    public AppendOutcome appendEvent(String code, MedicineEvent event) {
        AppendOutcome outcome = template.update(snapshot -> {
            boolean exists = snapshot.events().stream()
                .anyMatch(record -> record.matches(code, event.id()));
            if (exists) {
                return StoreUpdate.unchanged(AppendOutcome.SKIPPED);
            }
            snapshot.events().add(new EventRecord(code, event, clock.instant()));
            return StoreUpdate.write(AppendOutcome.INSERTED);
        });

        if (outcome == AppendOutcome.INSERTED) {
            log.info("Event stored: code={}, id={}, type={}, count={}",
                CodeMasking.mask(code), event.id(), event.type(), event.count());
        } else {
            log.debug("Duplicate event skipped: code={}, id={}", CodeMasking.mask(code), event.id());
        }
        return outcome;
    }

    /**
     * 查詢用戶所有事件，依儲存順序。
     *
     * @param code 用戶代碼
     * @return 事件清單；無事件時為空清單
     */
    public List<EventEntry> listEvents(String code) {
        List<EventEntry> events = template.read(snapshot -> snapshot.events().stream()
            .filter(ownedBy(code))
            .map(EventEntry::from)
            .toList());
        log.debug("listEvents: code={}, count={}", CodeMasking.mask(code), events.size());
        return events;
    }

    /**
     * 寫入舊版 log（舊版 client 的寫入路徑）。
     *
     * @param code 用戶代碼
     * @param legacyLog 已驗證的 log 內容
     */
    public void appendLegacyLog(String code, LegacyLog legacyLog) {
        template.update(snapshot -> {
            snapshot.logs().add(LegacyLogRecord.received(code, legacyLog, clock.instant()));
            return StoreUpdate.write(null);
        });
        log.info("Legacy log stored: code={}, date={}, spray={}, ventoline={}",
            CodeMasking.mask(code), legacyLog.date(), legacyLog.spray(), legacyLog.ventoline());
    }

    /**
     * 舊版讀取路徑：回傳用戶的 log 與收到時間，不受遷移影響。
     *
     * @param code 用戶代碼
     * @return log 清單，依儲存順序
     */
    public List<LegacyLogEntry> listLogsWithMetadata(String code) {
        return template.read(snapshot -> snapshot.logs().stream()
            .filter(ownedBy(code))
            .map(LegacyLogEntry::from)
            .toList());
    }

    private static Predicate<UsageRecord> ownedBy(String code) {
        return record -> code.equals(record.code());
    }

    /**
     * 事件新增結果。
     */
    public enum AppendOutcome {
        /** 新事件已儲存 */
        INSERTED,
        /** 相同 {@code (code, id)} 已存在，未寫入 */
        SKIPPED
    }
}
