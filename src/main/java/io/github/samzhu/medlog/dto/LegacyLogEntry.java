package io.github.samzhu.medlog.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.medlog.document.LegacyLogRecord;
import io.github.samzhu.medlog.document.MedicineType;

/**
 * 舊版讀取路徑的單筆結果，缺省的次數回報為 0，{@code date} 為儲存的原始字串。
 */
public record LegacyLogEntry(
    String date,
    int spray,
    int ventoline,
    @JsonProperty("received_at") Instant receivedAt
) {
    public static LegacyLogEntry from(LegacyLogRecord record) {
        return new LegacyLogEntry(
            record.log().date(),
            record.log().countFor(MedicineType.SPRAY),
            record.log().countFor(MedicineType.VENTOLINE),
            record.receivedAt()
        );
    }
}
