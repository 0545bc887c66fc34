package io.github.samzhu.medlog.repository;

import io.github.samzhu.medlog.document.StoreSnapshot;

/**
 * 整份文件的讀寫介面。
 *
 * <p>讀寫都是以整份快照為單位，不支援增量更新。兩個操作彼此不會交錯
 * （讀取不會看到寫到一半的文件），但「讀取 → 修改 → 寫回」的整段互斥
 * 由 {@link SnapshotTemplate} 負責，業務邏輯不應直接呼叫此介面。
 *
 * @see JsonFileSnapshotStore
 */
public interface SnapshotStore {

    /**
     * 讀取目前完整文件；文件不存在時以空集合建立後回傳。
     *
     * @return 可在記憶體中修改的快照
     * @throws io.github.samzhu.medlog.exception.StorageCorruptException 文件無法讀取或格式錯誤
     */
    StoreSnapshot read();

    /**
     * 以新快照持久化取代整份文件。
     *
     * @param snapshot 要寫入的快照
     * @throws io.github.samzhu.medlog.exception.StorageException 寫入失敗
     */
    void write(StoreSnapshot snapshot);
}
