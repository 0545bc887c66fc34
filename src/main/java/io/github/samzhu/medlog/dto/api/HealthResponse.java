package io.github.samzhu.medlog.dto.api;

/**
 * 健康檢查回應。
 */
public record HealthResponse(String status, String version) {}
