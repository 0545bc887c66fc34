package io.github.samzhu.medlog.dto;

import java.time.Instant;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.medlog.document.EventRecord;
import io.github.samzhu.medlog.document.MedicineEvent;
import io.github.samzhu.medlog.document.MedicineType;

/**
 * 查詢事件時回傳的單筆結果：事件欄位加上伺服器收到時間。
 */
public record EventEntry(
    String id,
    LocalDate date,
    String timestamp,
    MedicineType type,
    int count,
    boolean preventive,
    @JsonProperty("received_at") Instant receivedAt
) {
    /**
     * 從儲存的事件紀錄建立查詢結果。
     */
    public static EventEntry from(EventRecord record) {
        MedicineEvent event = record.event();
        return new EventEntry(
            event.id(),
            event.date(),
            event.timestamp(),
            event.type(),
            event.count(),
            event.preventive(),
            record.receivedAt()
        );
    }
}
