package io.github.samzhu.medlog.dto.api;

/**
 * Token 回應，用於 POST /generate-token。
 */
public record TokenResponse(String token) {}
