package io.github.samzhu.medlog.document;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 單筆用藥事件。
 *
 * <p>{@code id} 由 client 產生（通常是 UUID），作為冪等鍵：
 * 同一用戶重送相同 {@code id} 的事件不會產生第二筆紀錄。
 * {@code timestamp} 保留 client 送來的原始字串（ISO-8601，例如
 * {@code 2026-02-21T14:30:00.000Z}），不做正規化。
 *
 * @param id 事件 ID
 * @param date 使用日期
 * @param timestamp 使用時間點
 * @param type 藥物類型
 * @param count 次數，必為正數
 * @param preventive 是否為預防性使用
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MedicineEvent(
    String id,
    LocalDate date,
    String timestamp,
    MedicineType type,
    int count,
    boolean preventive
) {}
