package io.github.samzhu.medlog.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.medlog.dto.api.CodeRequest;
import io.github.samzhu.medlog.dto.api.CodeResponse;
import io.github.samzhu.medlog.dto.api.ErrorResponse;
import io.github.samzhu.medlog.dto.api.StatusResponse;
import io.github.samzhu.medlog.dto.api.TokenResponse;
import io.github.samzhu.medlog.service.CredentialService;
import io.github.samzhu.medlog.util.CodeMasking;

/**
 * 代碼與 token API 控制器。
 *
 * <p>提供代碼發放、代碼登入、token 換發與以 token 取回代碼的端點。
 */
@RestController
public class AuthApiController {

    private static final Logger log = LoggerFactory.getLogger(AuthApiController.class);

    static final String INVALID_CODE = "Invalid code";

    private final CredentialService credentialService;
    private final BearerTokenAuthenticator authenticator;

    public AuthApiController(CredentialService credentialService, BearerTokenAuthenticator authenticator) {
        this.credentialService = credentialService;
        this.authenticator = authenticator;
    }

    /**
     * 發放新代碼。
     */
    @PostMapping("/generate-code")
    public ResponseEntity<CodeResponse> generateCode() {
        return ResponseEntity.ok(new CodeResponse(credentialService.issueCode()));
    }

    /**
     * 以代碼登入。
     *
     * @param request 包含代碼的請求
     * @return {@code {"status": "ok"}}；代碼不存在時 400
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody @Validated CodeRequest request) {
        if (!credentialService.authenticateByCode(request.code())) {
            return ResponseEntity.badRequest().body(new ErrorResponse(INVALID_CODE));
        }
        return ResponseEntity.ok(StatusResponse.ok());
    }

    /**
     * 以代碼換發 token，同一代碼重複呼叫回傳相同 token。
     *
     * @param request 包含代碼的請求
     * @return {@code {"token": "..."}}；代碼不存在時 400
     */
    @PostMapping("/generate-token")
    public ResponseEntity<?> generateToken(@RequestBody @Validated CodeRequest request) {
        return credentialService.issueToken(request.code())
            .<ResponseEntity<?>>map(token -> ResponseEntity.ok(new TokenResponse(token)))
            .orElseGet(() -> ResponseEntity.badRequest().body(new ErrorResponse(INVALID_CODE)));
    }

    /**
     * 以 token 取回代碼，供其他裝置設定同步使用。
     */
    @GetMapping("/code")
    public ResponseEntity<CodeResponse> getCode(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String code = authenticator.authenticate(authorization);
        log.debug("Code retrieved by token: code={}", CodeMasking.mask(code));
        return ResponseEntity.ok(new CodeResponse(code));
    }
}
