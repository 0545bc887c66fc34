package io.github.samzhu.medlog.exception;

/**
 * 管理端點未啟用或 {@code X-Admin-Token} 不符，對應 HTTP 403。
 */
public class AdminAccessDeniedException extends RuntimeException {

    public AdminAccessDeniedException(String message) {
        super(message);
    }
}
