package io.github.samzhu.medlog.repository;

/**
 * {@link SnapshotTemplate#update} 回呼的結果：回傳值以及快照是否被修改。
 *
 * <p>只有 {@code dirty} 為 true 時才會寫回文件。
 *
 * @param result 回傳給呼叫端的值
 * @param dirty 快照是否已被修改
 * @param <T> 回傳值型別
 */
public record StoreUpdate<T>(T result, boolean dirty) {

    /**
     * 快照已修改，需要寫回。
     */
    public static <T> StoreUpdate<T> write(T result) {
        return new StoreUpdate<>(result, true);
    }

    /**
     * 快照未修改，不需寫回。
     */
    public static <T> StoreUpdate<T> unchanged(T result) {
        return new StoreUpdate<>(result, false);
    }
}
