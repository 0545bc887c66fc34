package io.github.samzhu.medlog.dto.api;

/**
 * 錯誤回應，格式為 {@code {"error": "..."}}。
 */
public record ErrorResponse(String error) {}
