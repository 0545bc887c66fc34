package io.github.samzhu.medlog.dto.api;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.github.samzhu.medlog.document.MedicineEvent;
import io.github.samzhu.medlog.document.MedicineType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 新增用藥事件請求。
 *
 * <p>用於 POST /events 端點。{@code date} 與 {@code type} 的格式錯誤
 * 在 JSON 轉換階段即被拒絕；其餘欄位由 Bean Validation 檢查。
 */
public record EventRequest(
    @NotNull(message = "'event' (object) is required")
    @Valid
    EventPayload event
) {

    /**
     * 事件內容。
     */
    public record EventPayload(
        @NotBlank(message = "id is required")
        String id,

        @NotNull(message = "date is required")
        LocalDate date,

        @NotBlank(message = "timestamp is required")
        String timestamp,

        @NotNull(message = "type is required")
        MedicineType type,

        @NotNull(message = "count is required")
        @Min(value = 1, message = "count must be at least 1")
        Integer count,

        Boolean preventive
    ) {
        /**
         * timestamp 必須是 ISO-8601 日期時間（可帶時區偏移）。
         */
        @JsonIgnore
        @AssertTrue(message = "timestamp must be a valid ISO 8601 datetime")
        public boolean isTimestampValid() {
            if (timestamp == null || timestamp.isBlank()) {
                return true;
            }
            try {
                OffsetDateTime.parse(timestamp);
                return true;
            } catch (DateTimeParseException e) {
                try {
                    LocalDateTime.parse(timestamp);
                    return true;
                } catch (DateTimeParseException ignored) {
                    return false;
                }
            }
        }

        /**
         * 轉為核心使用的事件，{@code preventive} 缺省為 false。
         */
        public MedicineEvent toMedicineEvent() {
            return new MedicineEvent(id, date, timestamp, type, count, Boolean.TRUE.equals(preventive));
        }
    }
}
