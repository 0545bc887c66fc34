package io.github.samzhu.medlog.dto.api;

import java.util.List;

import io.github.samzhu.medlog.dto.EventEntry;

/**
 * 事件列表回應，用於 GET /events。
 */
public record EventListResponse(List<EventEntry> events) {}
