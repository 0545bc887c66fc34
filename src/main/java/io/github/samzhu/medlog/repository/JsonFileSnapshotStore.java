package io.github.samzhu.medlog.repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.document.StoreSnapshot;
import io.github.samzhu.medlog.exception.StorageCorruptException;
import io.github.samzhu.medlog.exception.StorageException;

/**
 * 以單一 JSON 檔案實作的 {@link SnapshotStore}。
 *
 * <p>寫入流程：
 * <ol>
 *   <li>序列化整份快照到同目錄的暫存檔 ({@code <file>.tmp})</li>
 *   <li>以 atomic move 取代目標檔；檔案系統不支援時退回一般取代</li>
 * </ol>
 * 因此讀取端只會看到舊文件或新文件，不會看到寫到一半的內容。
 *
 * <p>使用注入的 {@link ObjectMapper} 的複本，固定文件格式所需的設定
 * （ISO-8601 時間字串、忽略未知欄位、縮排輸出），不受全域 Jackson 設定影響。
 */
@Component
public class JsonFileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSnapshotStore.class);

    private final ObjectMapper mapper;
    private final Path dataFile;

    @Autowired
    public JsonFileSnapshotStore(ObjectMapper objectMapper, MedlogProperties properties) {
        this(objectMapper, Path.of(properties.storage().dataFile()));
    }

    public JsonFileSnapshotStore(ObjectMapper objectMapper, Path dataFile) {
        this.mapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.dataFile = dataFile.toAbsolutePath();
        log.info("JsonFileSnapshotStore initialized: dataFile={}", this.dataFile);
    }

    @Override
    public StoreSnapshot read() {
        ensureDataFile();

        byte[] raw;
        try {
            raw = Files.readAllBytes(dataFile);
        } catch (IOException e) {
            throw new StorageCorruptException(dataFile, e);
        }
        if (raw.length == 0) {
            throw new StorageCorruptException(dataFile, new IOException("Storage document is empty"));
        }

        StoreSnapshot snapshot;
        try {
            snapshot = mapper.readValue(raw, StoreSnapshot.class);
        } catch (IOException e) {
            throw new StorageCorruptException(dataFile, e);
        }
        if (snapshot == null) {
            throw new StorageCorruptException(dataFile, new IOException("Storage document is null"));
        }

        log.debug("Snapshot read: codes={}, logs={}, events={}",
            snapshot.codes().size(), snapshot.logs().size(), snapshot.events().size());
        return snapshot;
    }

    @Override
    public void write(StoreSnapshot snapshot) {
        ensureDirectory();
        Path tmp = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported, falling back to plain replace: {}", dataFile);
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write storage document", dataFile, e);
        }

        log.debug("Snapshot written: codes={}, logs={}, events={}",
            snapshot.codes().size(), snapshot.logs().size(), snapshot.events().size());
    }

    /**
     * @return 儲存檔的絕對路徑
     */
    public Path getDataFile() {
        return dataFile;
    }

    private void ensureDataFile() {
        if (Files.exists(dataFile)) {
            return;
        }
        log.info("Storage document not found, creating empty document: {}", dataFile);
        write(StoreSnapshot.empty());
    }

    private void ensureDirectory() {
        Path parent = dataFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory", dataFile, e);
        }
    }
}
