package io.github.samzhu.medlog.exception;

/**
 * Bearer token 缺少、格式錯誤或無效，對應 HTTP 401。
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
