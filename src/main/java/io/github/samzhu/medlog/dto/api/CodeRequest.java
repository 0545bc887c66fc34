package io.github.samzhu.medlog.dto.api;

import jakarta.validation.constraints.NotBlank;

/**
 * 以代碼登入或換發 token 的請求。
 *
 * <p>用於 POST /login 與 POST /generate-token 端點。
 */
public record CodeRequest(
    @NotBlank(message = "Code is required")
    String code
) {}
