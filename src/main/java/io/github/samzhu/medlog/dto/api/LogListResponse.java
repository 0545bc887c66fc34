package io.github.samzhu.medlog.dto.api;

import java.util.List;

import io.github.samzhu.medlog.dto.LegacyLogEntry;

/**
 * 舊版 log 列表回應，用於 GET /logs。
 */
public record LogListResponse(List<LegacyLogEntry> logs) {}
