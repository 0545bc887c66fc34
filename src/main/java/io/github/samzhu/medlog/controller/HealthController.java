package io.github.samzhu.medlog.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.dto.api.HealthResponse;

/**
 * 健康檢查端點，供監控與容器健康檢查使用。
 */
@RestController
public class HealthController {

    private final String version;

    public HealthController(MedlogProperties properties) {
        this.version = properties.version();
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", version));
    }
}
