package io.github.samzhu.medlog.document;

import java.time.Instant;

/**
 * 儲存邊界上的用藥紀錄：舊版 log 或目前的事件。
 *
 * <p>兩種格式並存於同一份文件（{@code logs} 與 {@code events} 集合），
 * 以 sealed interface 表示，讓遷移的輸入與輸出型別在編譯期即被檢查。
 */
public sealed interface UsageRecord permits LegacyLogRecord, EventRecord {

    /** @return 所屬用戶代碼 */
    String code();

    /** @return 伺服器收到紀錄的時間 */
    Instant receivedAt();
}
