package io.github.samzhu.medlog.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.medlog.dto.api.EventListResponse;
import io.github.samzhu.medlog.dto.api.EventRequest;
import io.github.samzhu.medlog.dto.api.StatusResponse;
import io.github.samzhu.medlog.service.EventLedgerService;
import io.github.samzhu.medlog.service.EventLedgerService.AppendOutcome;

/**
 * 用藥事件 API 控制器，所有端點都需要 bearer token。
 */
@RestController
@RequestMapping("/events")
public class EventApiController {

    private final EventLedgerService eventLedgerService;
    private final BearerTokenAuthenticator authenticator;

    public EventApiController(EventLedgerService eventLedgerService, BearerTokenAuthenticator authenticator) {
        this.eventLedgerService = eventLedgerService;
        this.authenticator = authenticator;
    }

    /**
     * 新增單筆事件，重送相同 ID 回傳 {@code skipped}。
     */
    @PostMapping
    public ResponseEntity<StatusResponse> saveEvent(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Validated EventRequest request) {
        String code = authenticator.authenticate(authorization);
        AppendOutcome outcome = eventLedgerService.appendEvent(code, request.event().toMedicineEvent());
        return ResponseEntity.ok(outcome == AppendOutcome.INSERTED
            ? StatusResponse.saved()
            : StatusResponse.skipped());
    }

    /**
     * 查詢目前用戶的所有事件，依儲存順序。
     */
    @GetMapping
    public ResponseEntity<EventListResponse> getEvents(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String code = authenticator.authenticate(authorization);
        return ResponseEntity.ok(new EventListResponse(eventLedgerService.listEvents(code)));
    }
}
