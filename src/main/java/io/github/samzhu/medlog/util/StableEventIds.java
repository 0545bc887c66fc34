package io.github.samzhu.medlog.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.UUID;

import io.github.samzhu.medlog.document.MedicineType;

/**
 * 遷移事件的決定性 ID 產生工具。
 *
 * <p>舊版 log 沒有自然識別碼，因此以內容推導 ID：
 * 相同的 {@code (code, date, type)} 在任何一次執行都得到相同 ID，
 * 重複遷移（包含期間舊版 client 又寫入新 log）不會產生重複事件。
 *
 * <p>演算法：RFC 4122 name-based version 5 UUID (SHA-1)。
 * <ul>
 *   <li>namespace：{@link #LEGACY_LOG_NAMESPACE_V1}</li>
 *   <li>name：UTF-8 字串 {@code <code>:<YYYY-MM-DD>:<type>}，例如 {@code ABC123:2026-01-15:spray}</li>
 * </ul>
 * 與 Python {@code uuid.uuid5(namespace, name)} 結果一致，其他實作可互通。
 *
 * <p>所有方法皆為純函式，無副作用。
 */
public final class StableEventIds {

    /**
     * 舊版 log 遷移 (v1) 使用的固定 namespace。變更此值會改變所有遷移事件的 ID。
     */
    public static final UUID LEGACY_LOG_NAMESPACE_V1 =
        UUID.fromString("5b1f0f7e-3c1d-4d8a-9a51-0c7d2e6b4f10");

    private StableEventIds() {
    }

    /**
     * 以預設 namespace 推導遷移事件 ID。
     *
     * @param code 用戶代碼
     * @param date 使用日期
     * @param type 藥物類型
     * @return 小寫、含連字號的 UUID 字串
     */
    public static String derive(String code, LocalDate date, MedicineType type) {
        return derive(LEGACY_LOG_NAMESPACE_V1, code, date, type);
    }

    /**
     * 以指定 namespace 推導遷移事件 ID。
     */
    public static String derive(UUID namespace, String code, LocalDate date, MedicineType type) {
        String name = code + ":" + date + ":" + type.value();
        return nameUuidV5(namespace, name).toString();
    }

    /**
     * 產生 version 5 (SHA-1) name-based UUID。
     *
     * @param namespace namespace UUID
     * @param name 名稱，以 UTF-8 編碼
     * @return version 5、IETF variant 的 UUID
     */
    public static UUID nameUuidV5(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }

        ByteBuffer ns = ByteBuffer.allocate(16);
        ns.putLong(namespace.getMostSignificantBits());
        ns.putLong(namespace.getLeastSignificantBits());
        sha1.update(ns.array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50); // version 5
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80); // IETF variant

        ByteBuffer bytes = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(bytes.getLong(), bytes.getLong());
    }
}
