package io.github.samzhu.medlog.exception;

import java.nio.file.Path;

/**
 * 儲存文件無法讀取或格式錯誤。
 *
 * <p>屬於致命錯誤：
 * <ul>
 *   <li>核心不會嘗試修復或覆寫該文件</li>
 *   <li>所有操作都會失敗，直到文件被人工修正</li>
 *   <li>文件不存在則不屬於此情況（會以空集合建立）</li>
 * </ul>
 */
public class StorageCorruptException extends StorageException {

    public StorageCorruptException(Path dataFile, Throwable cause) {
        super("Storage document is unreadable or malformed", dataFile, cause);
    }
}
