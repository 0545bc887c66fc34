package io.github.samzhu.medlog.controller;

import java.util.Optional;

import org.springframework.stereotype.Component;

import io.github.samzhu.medlog.exception.UnauthorizedException;
import io.github.samzhu.medlog.service.CredentialService;

/**
 * 解析 {@code Authorization: Bearer <token>} header 並找回所屬代碼。
 */
@Component
public class BearerTokenAuthenticator {

    static final String MISSING_HEADER = "Authorization header required";
    static final String INVALID_FORMAT = "Invalid authorization format. Use: Bearer <token>";
    static final String INVALID_TOKEN = "Invalid token";

    private static final String BEARER = "Bearer";

    private final CredentialService credentialService;

    public BearerTokenAuthenticator(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    /**
     * 必要的 token 驗證。
     *
     * @param header {@code Authorization} header 原始值，可為 null
     * @return token 所屬代碼
     * @throws UnauthorizedException header 缺少、格式錯誤或 token 無效
     */
    public String authenticate(String header) {
        if (header == null || header.isBlank()) {
            throw new UnauthorizedException(MISSING_HEADER);
        }
        String token = parseToken(header)
            .orElseThrow(() -> new UnauthorizedException(INVALID_FORMAT));
        return resolve(token);
    }

    /**
     * 選用的 token 驗證，供可改用代碼驗證的端點使用。
     *
     * <p>header 缺少或不是 Bearer 格式時回傳 empty，交由呼叫端改用代碼；
     * 格式正確但 token 無效時仍拒絕。
     *
     * @param header {@code Authorization} header 原始值，可為 null
     * @return token 所屬代碼
     * @throws UnauthorizedException token 無效
     */
    public Optional<String> tryAuthenticate(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        return parseToken(header).map(this::resolve);
    }

    private String resolve(String token) {
        return credentialService.resolveToken(token)
            .orElseThrow(() -> new UnauthorizedException(INVALID_TOKEN));
    }

    private static Optional<String> parseToken(String header) {
        String[] parts = header.trim().split("\\s+");
        if (parts.length != 2 || !BEARER.equals(parts[0])) {
            return Optional.empty();
        }
        return Optional.of(parts[1]);
    }
}
