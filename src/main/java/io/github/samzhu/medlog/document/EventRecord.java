package io.github.samzhu.medlog.document;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 事件紀錄，儲存於文件的 {@code events} 集合。
 *
 * <p>同一 {@code code} 下 {@code event.id} 唯一。建立後不可變；
 * 遷移產生的事件使用相同結構並遵守相同的唯一性。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventRecord(
    String code,
    MedicineEvent event,
    @JsonProperty("received_at") Instant receivedAt
) implements UsageRecord {

    /**
     * 判斷此紀錄是否屬於指定用戶且具有指定事件 ID。
     */
    public boolean matches(String ownerCode, String eventId) {
        return code.equals(ownerCode) && event.id().equals(eventId);
    }
}
