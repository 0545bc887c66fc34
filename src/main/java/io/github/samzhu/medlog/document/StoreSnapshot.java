package io.github.samzhu.medlog.document;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 儲存文件的完整快照。
 *
 * <p>文件格式（唯一需要位元層級相容的外部契約）：
 * <pre>
 * {
 *   "codes":  [ CredentialRecord... ],
 *   "logs":   [ LegacyLogRecord... ],
 *   "events": [ EventRecord... ]
 * }
 * </pre>
 *
 * <p>三個集合一律存在；讀入舊文件時缺少的集合補為空陣列。
 * 各集合為可變的 {@link ArrayList}：每次邏輯更新都是
 * 「讀取整份快照 → 在記憶體中修改 → 寫回整份快照」，
 * 由 {@link io.github.samzhu.medlog.repository.SnapshotTemplate} 的鎖保護。
 */
@JsonPropertyOrder({"codes", "logs", "events"})
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreSnapshot(
    List<CredentialRecord> codes,
    List<LegacyLogRecord> logs,
    List<EventRecord> events
) {
    public StoreSnapshot {
        codes = codes == null ? new ArrayList<>() : new ArrayList<>(codes);
        logs = logs == null ? new ArrayList<>() : new ArrayList<>(logs);
        events = events == null ? new ArrayList<>() : new ArrayList<>(events);
    }

    /**
     * 建立三個集合皆為空的預設文件。
     */
    public static StoreSnapshot empty() {
        return new StoreSnapshot(null, null, null);
    }
}
