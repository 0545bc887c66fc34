package io.github.samzhu.medlog.dto.api;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.github.samzhu.medlog.document.LegacyLogRecord.LegacyLog;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * 舊版 log 寫入請求。
 *
 * <p>用於 POST /logs 端點。驗證方式二擇一：
 * <ul>
 *   <li>{@code Authorization: Bearer <token>} header（優先）</li>
 *   <li>body 中的 {@code code}</li>
 * </ul>
 */
public record LogRequest(
    String code,

    @NotNull(message = "'log' (object) is required")
    @Valid
    LogPayload log
) {

    /**
     * log 內容，至少一種藥物次數大於 0。
     */
    public record LogPayload(
        @NotNull(message = "date is required")
        LocalDate date,

        @PositiveOrZero(message = "Medicine count must be non-negative")
        Integer spray,

        @PositiveOrZero(message = "Medicine count must be non-negative")
        Integer ventoline,

        Boolean preventive
    ) {
        @JsonIgnore
        @AssertTrue(message = "At least one medicine type must have a non-zero count")
        public boolean isAnyMedicineCounted() {
            int sprayCount = spray == null ? 0 : spray;
            int ventolineCount = ventoline == null ? 0 : ventoline;
            return sprayCount > 0 || ventolineCount > 0;
        }

        public LegacyLog toLegacyLog() {
            return new LegacyLog(date.toString(), spray, ventoline, preventive);
        }
    }
}
