package io.github.samzhu.medlog.dto.api;

/**
 * 代碼回應，用於 POST /generate-code 與 GET /code。
 */
public record CodeResponse(String code) {}
