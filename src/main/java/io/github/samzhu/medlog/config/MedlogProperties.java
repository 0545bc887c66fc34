package io.github.samzhu.medlog.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Medlog 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link StorageConfig} - JSON 儲存檔位置</li>
 *   <li>{@link CredentialConfig} - 代碼產生設定</li>
 *   <li>{@link MigrationConfig} - 舊版 log 遷移的排程設定</li>
 *   <li>{@link CorsConfig} - 前端跨來源設定</li>
 *   <li>{@link AdminConfig} - 管理端點的存取 token</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * medlog:
 *   version: 0.1.0
 *   storage:
 *     data-file: data/storage.json
 *   credential:
 *     max-code-attempts: 10
 *   migration:
 *     run-on-startup: true
 *     cron: "0 0 * * * *"
 *   cors:
 *     allowed-origins: "*"
 *   admin:
 *     token: change-me
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "medlog")
public record MedlogProperties(
    String version,
    StorageConfig storage,
    CredentialConfig credential,
    MigrationConfig migration,
    CorsConfig cors,
    AdminConfig admin
) {
    public MedlogProperties {
        if (version == null || version.isBlank()) {
            version = "0.1.0";
        }
        if (storage == null) {
            storage = StorageConfig.defaults();
        }
        if (credential == null) {
            credential = CredentialConfig.defaults();
        }
        if (migration == null) {
            migration = MigrationConfig.defaults();
        }
        if (cors == null) {
            cors = CorsConfig.defaults();
        }
        if (admin == null) {
            admin = new AdminConfig(null);
        }
    }

    /**
     * 建立全部使用預設值的設定。
     */
    public static MedlogProperties defaults() {
        return new MedlogProperties(null, null, null, null, null, null);
    }

    /**
     * 儲存設定。
     *
     * @param dataFile JSON 文件路徑，預設 {@code data/storage.json}
     */
    public record StorageConfig(String dataFile) {
        public StorageConfig {
            if (dataFile == null || dataFile.isBlank()) {
                dataFile = "data/storage.json";
            }
        }

        public static StorageConfig defaults() {
            return new StorageConfig(null);
        }
    }

    /**
     * 代碼產生設定。
     *
     * <p>代碼空間為 36^6，碰撞機率極低；碰撞時重新產生，
     * 超過 {@code maxCodeAttempts} 次仍碰撞則放棄。
     *
     * @param maxCodeAttempts 最大嘗試次數，預設 10
     */
    public record CredentialConfig(int maxCodeAttempts) {
        public CredentialConfig {
            if (maxCodeAttempts <= 0) {
                maxCodeAttempts = 10;
            }
        }

        public static CredentialConfig defaults() {
            return new CredentialConfig(10);
        }
    }

    /**
     * 舊版 log 遷移設定。
     *
     * <p>排程 Cron 不在此綁定：{@code medlog.migration.cron} 由
     * {@link io.github.samzhu.medlog.service.LegacyMigrationService} 的
     * {@code @Scheduled(cron = "${medlog.migration.cron:0 0 * * * *}")} 直接解析，
     * 預設每小時整點，設為 {@code "-"} 可停用排程。
     *
     * @param runOnStartup 應用程式啟動完成後是否執行一次遷移
     */
    public record MigrationConfig(Boolean runOnStartup) {
        public MigrationConfig {
            if (runOnStartup == null) {
                runOnStartup = Boolean.TRUE;
            }
        }

        public static MigrationConfig defaults() {
            return new MigrationConfig(true);
        }
    }

    /**
     * 跨來源設定。
     *
     * @param allowedOrigins 允許的來源 pattern，預設 {@code *}
     */
    public record CorsConfig(List<String> allowedOrigins) {
        public CorsConfig {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                allowedOrigins = List.of("*");
            }
        }

        public static CorsConfig defaults() {
            return new CorsConfig(List.of("*"));
        }
    }

    /**
     * 管理端點設定。
     *
     * @param token {@code X-Admin-Token} 需比對的值；未設定時管理端點一律拒絕
     */
    public record AdminConfig(String token) {

        public boolean enabled() {
            return token != null && !token.isBlank();
        }
    }
}
