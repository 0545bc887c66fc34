package io.github.samzhu.medlog.repository;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.github.samzhu.medlog.document.StoreSnapshot;

/**
 * 整份文件「讀取 → 修改 → 寫回」的互斥執行範本。
 *
 * <p>整個 process 只有一把鎖（非以 code 分片），在讀取、修改、寫回期間持有，
 * 使並行的 {@code appendEvent}、{@code issueToken}、{@code migrate} 呈現為
 * 可線性化的整份文件更新序列：
 * <ul>
 *   <li>不會遺失更新</li>
 *   <li>不會交錯寫入</li>
 *   <li>所有離開路徑（含例外）都會釋放鎖</li>
 * </ul>
 *
 * <p>鎖內只有本機檔案存取，沒有網路 I/O。寫入吞吐量因此受限，
 * 但文件大小與寫入頻率都很小，可以接受。
 *
 * @see SnapshotStore
 */
@Component
public class SnapshotTemplate {

    private static final Logger log = LoggerFactory.getLogger(SnapshotTemplate.class);

    private final SnapshotStore store;
    private final ReentrantLock lock = new ReentrantLock(true);

    public SnapshotTemplate(SnapshotStore store) {
        this.store = store;
    }

    /**
     * 在鎖內讀取快照並投影出結果，不寫回。
     *
     * @param reader 由快照計算結果的函式，不應修改快照
     * @return 投影結果
     */
    public <T> T read(Function<StoreSnapshot, T> reader) {
        lock.lock();
        try {
            return reader.apply(store.read());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在鎖內讀取快照、交由回呼修改，並在回呼標記為已修改時寫回。
     *
     * @param mutator 修改快照並回傳 {@link StoreUpdate} 的函式
     * @return 回呼的結果值
     */
    public <T> T update(Function<StoreSnapshot, StoreUpdate<T>> mutator) {
        lock.lock();
        try {
            StoreSnapshot snapshot = store.read();
            StoreUpdate<T> update = mutator.apply(snapshot);
            if (update.dirty()) {
                store.write(snapshot);
            } else {
                log.debug("Snapshot unchanged, skipping write");
            }
            return update.result();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 目前是否有執行緒持有鎖，用於監控與測試。
     */
    public boolean isLocked() {
        return lock.isLocked();
    }
}
