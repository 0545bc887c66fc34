package io.github.samzhu.medlog.controller;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.exception.AdminAccessDeniedException;
import io.github.samzhu.medlog.service.LegacyMigrationService;
import io.github.samzhu.medlog.service.LegacyMigrationService.MigrationResult;

/**
 * 管理 API 控制器。
 *
 * <p>以 {@code X-Admin-Token} header 比對 {@code medlog.admin.token}；
 * 未設定 token 時所有管理端點回傳 403。
 */
@RestController
@RequestMapping("/admin")
public class AdminApiController {

    private static final Logger log = LoggerFactory.getLogger(AdminApiController.class);

    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final LegacyMigrationService migrationService;
    private final MedlogProperties.AdminConfig adminConfig;

    public AdminApiController(LegacyMigrationService migrationService, MedlogProperties properties) {
        this.migrationService = migrationService;
        this.adminConfig = properties.admin();
    }

    /**
     * 手動觸發舊版 log 遷移。
     *
     * @param adminToken 管理 token
     * @return 遷移結果統計
     */
    @PostMapping("/migrate-logs")
    public ResponseEntity<MigrationResult> migrateLogs(
            @RequestHeader(value = ADMIN_TOKEN_HEADER, required = false) String adminToken) {
        verifyAdminToken(adminToken);
        log.info("Manual legacy migration triggered");
        return ResponseEntity.ok(migrationService.migrate());
    }

    private void verifyAdminToken(String adminToken) {
        if (!adminConfig.enabled()) {
            throw new AdminAccessDeniedException("Admin endpoints are disabled");
        }
        if (adminToken == null || !MessageDigest.isEqual(
                adminToken.getBytes(StandardCharsets.UTF_8),
                adminConfig.token().getBytes(StandardCharsets.UTF_8))) {
            log.warn("Admin request rejected: invalid {}", ADMIN_TOKEN_HEADER);
            throw new AdminAccessDeniedException("Invalid admin token");
        }
    }
}
