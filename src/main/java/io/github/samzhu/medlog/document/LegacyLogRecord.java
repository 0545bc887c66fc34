package io.github.samzhu.medlog.document;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 舊版 log 紀錄，儲存於文件的 {@code logs} 集合。
 *
 * <p>舊版 client 以「日期 + 各藥物次數」的形式寫入，沒有事件 ID 也沒有時間點。
 * 核心只會新增，不會修改或刪除；遷移時唯讀。
 *
 * <p>舊版服務直接儲存 client 送來的內容，因此本類別保留原始文字：
 * <ul>
 *   <li>{@code date} 與 {@code received_at} 以讀入時的字串寫回</li>
 *   <li>未知欄位收集於額外欄位 map 並原樣寫回</li>
 * </ul>
 * 任一紀錄內容不合預期也不影響整份文件的讀寫；解析只在遷移時進行。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "log", "received_at"})
public final class LegacyLogRecord implements UsageRecord {

    private final String code;
    private final LegacyLog log;
    private final String receivedAt;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    @JsonCreator
    public LegacyLogRecord(
            @JsonProperty("code") String code,
            @JsonProperty("log") LegacyLog log,
            @JsonProperty("received_at") String receivedAt) {
        this.code = code;
        this.log = log;
        this.receivedAt = receivedAt;
    }

    /**
     * 建立新收到的舊版 log 紀錄。
     *
     * @param code 用戶代碼
     * @param log log 內容
     * @param receivedAt 收到時間，可為 null
     */
    public static LegacyLogRecord received(String code, LegacyLog log, Instant receivedAt) {
        return new LegacyLogRecord(code, log, receivedAt == null ? null : receivedAt.toString());
    }

    @Override
    @JsonProperty("code")
    public String code() {
        return code;
    }

    @JsonProperty("log")
    public LegacyLog log() {
        return log;
    }

    /**
     * @return 文件中的 {@code received_at} 原始字串
     */
    @JsonProperty("received_at")
    public String receivedAtText() {
        return receivedAt;
    }

    /**
     * 解析後的收到時間；缺少或無法解析時為 null。
     */
    @Override
    public Instant receivedAt() {
        return parseInstant(receivedAt);
    }

    @JsonAnyGetter
    public Map<String, Object> extra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extra.put(name, value);
    }

    /**
     * 解析 ISO-8601 時間，接受 {@code Z}、{@code +00:00} 偏移或不帶偏移（視為 UTC）。
     */
    static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    /**
     * 舊版 log 內容。
     *
     * <p>{@code spray} 與 {@code ventoline} 可能缺省；上游驗證保證至少一項大於 0。
     * {@code date} 保留原始字串，舊版服務接受未補零的日期（例如 {@code 2026-1-5}）。
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"date", "spray", "ventoline", "preventive"})
    public static final class LegacyLog {

        private static final DateTimeFormatter LENIENT_DATE =
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT);

        private final String date;
        private final Integer spray;
        private final Integer ventoline;
        private final Boolean preventive;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        /**
         * @param date 使用日期 (YYYY-MM-DD)
         * @param spray 噴劑次數
         * @param ventoline Ventoline 次數
         * @param preventive 是否為預防性使用（舊版 client 可能未提供）
         */
        @JsonCreator
        public LegacyLog(
                @JsonProperty("date") String date,
                @JsonProperty("spray") Integer spray,
                @JsonProperty("ventoline") Integer ventoline,
                @JsonProperty("preventive") Boolean preventive) {
            this.date = date;
            this.spray = spray;
            this.ventoline = ventoline;
            this.preventive = preventive;
        }

        @JsonProperty("date")
        public String date() {
            return date;
        }

        @JsonProperty("spray")
        public Integer spray() {
            return spray;
        }

        @JsonProperty("ventoline")
        public Integer ventoline() {
            return ventoline;
        }

        @JsonProperty("preventive")
        public Boolean preventive() {
            return preventive;
        }

        @JsonAnyGetter
        public Map<String, Object> extra() {
            return extra;
        }

        @JsonAnySetter
        public void putExtra(String name, Object value) {
            extra.put(name, value);
        }

        /**
         * 解析使用日期，接受補零與未補零的月、日。
         *
         * @return 日期；缺少或格式錯誤時為 empty
         */
        public Optional<LocalDate> parsedDate() {
            if (date == null) {
                return Optional.empty();
            }
            try {
                return Optional.of(LocalDate.parse(date.trim(), LENIENT_DATE));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }

        /**
         * 取得指定藥物的次數，缺省視為 0。
         *
         * @param type 藥物類型
         * @return 次數
         */
        public int countFor(MedicineType type) {
            Integer count = switch (type) {
                case SPRAY -> spray;
                case VENTOLINE -> ventoline;
            };
            return count == null ? 0 : count;
        }
    }
}
