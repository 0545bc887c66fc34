package io.github.samzhu.medlog.exception;

import java.nio.file.Path;

/**
 * 儲存文件存取失敗。
 *
 * <p>核心不做自動重試；重試或退避策略由呼叫端決定。
 */
public class StorageException extends RuntimeException {

    private final Path dataFile;

    public StorageException(String message, Path dataFile, Throwable cause) {
        super(String.format("%s: file='%s'", message, dataFile), cause);
        this.dataFile = dataFile;
    }

    public Path getDataFile() {
        return dataFile;
    }
}
