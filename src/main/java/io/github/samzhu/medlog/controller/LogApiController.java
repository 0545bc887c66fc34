package io.github.samzhu.medlog.controller;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.medlog.dto.api.ErrorResponse;
import io.github.samzhu.medlog.dto.api.LogListResponse;
import io.github.samzhu.medlog.dto.api.LogRequest;
import io.github.samzhu.medlog.dto.api.StatusResponse;
import io.github.samzhu.medlog.service.CredentialService;
import io.github.samzhu.medlog.service.EventLedgerService;
import io.github.samzhu.medlog.util.CodeMasking;

/**
 * 舊版 log API 控制器，供尚未改用事件的 client 使用。
 *
 * <p>寫入時 bearer token 優先；沒有 Bearer header 時改用 body 中的代碼。
 */
@RestController
@RequestMapping("/logs")
public class LogApiController {

    private static final Logger log = LoggerFactory.getLogger(LogApiController.class);

    static final String AUTH_REQUIRED = "Either 'code' in body or 'Authorization' header is required";
    static final String UNKNOWN_CODE = "Unknown code";

    private final EventLedgerService eventLedgerService;
    private final CredentialService credentialService;
    private final BearerTokenAuthenticator authenticator;

    public LogApiController(
            EventLedgerService eventLedgerService,
            CredentialService credentialService,
            BearerTokenAuthenticator authenticator) {
        this.eventLedgerService = eventLedgerService;
        this.credentialService = credentialService;
        this.authenticator = authenticator;
    }

    /**
     * 寫入一筆舊版 log。
     *
     * @param authorization 選用的 {@code Authorization} header
     * @param request log 請求
     * @return {@code {"status": "saved"}}
     */
    @PostMapping
    public ResponseEntity<?> saveLog(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody @Validated LogRequest request) {
        Optional<String> tokenCode = authenticator.tryAuthenticate(authorization);

        String code;
        if (tokenCode.isPresent()) {
            code = tokenCode.get();
        } else {
            code = request.code();
            if (code == null || code.isBlank()) {
                return ResponseEntity.badRequest().body(new ErrorResponse(AUTH_REQUIRED));
            }
            if (!credentialService.codeExists(code)) {
                log.debug("Log rejected, unknown code: code={}", CodeMasking.mask(code));
                return ResponseEntity.badRequest().body(new ErrorResponse(UNKNOWN_CODE));
            }
        }

        eventLedgerService.appendLegacyLog(code, request.log().toLegacyLog());
        return ResponseEntity.ok(StatusResponse.saved());
    }

    /**
     * 查詢目前用戶的所有舊版 log。
     */
    @GetMapping
    public ResponseEntity<LogListResponse> getLogs(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String code = authenticator.authenticate(authorization);
        return ResponseEntity.ok(new LogListResponse(eventLedgerService.listLogsWithMetadata(code)));
    }
}
