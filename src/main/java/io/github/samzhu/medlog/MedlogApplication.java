package io.github.samzhu.medlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Medlog Service - 個人用藥紀錄服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>發放短代碼 (code)，並換發長效 bearer token</li>
 *   <li>以用戶為單位儲存用藥事件，依 client 提供的事件 ID 做冪等去重</li>
 *   <li>將舊版 log 紀錄遷移為事件紀錄（決定性 ID，可重複執行）</li>
 *   <li>提供 REST API 給前端寫入與查詢</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Client → REST API → CredentialService / EventLedgerService / LegacyMigrationService
 *                                  ↓
 *                         SnapshotTemplate (單一鎖)
 *                                  ↓
 *                     storage.json { codes, logs, events }
 * </pre>
 */
@SpringBootApplication
@EnableScheduling
public class MedlogApplication {

    private static final Logger log = LoggerFactory.getLogger(MedlogApplication.class);

    public static void main(String[] args) {
        log.info("Starting Medlog Service - medicine usage logger");
        SpringApplication.run(MedlogApplication.class, args);
    }
}
