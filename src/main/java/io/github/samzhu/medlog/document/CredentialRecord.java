package io.github.samzhu.medlog.document;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 憑證紀錄，儲存於文件的 {@code codes} 集合。
 *
 * <p>生命週期：
 * <ul>
 *   <li>發放代碼時建立，只有 {@code code} 與 {@code created_at}</li>
 *   <li>第一次換發 token 時寫入 {@code token} 與 {@code token_generated_at}，之後不再變動</li>
 *   <li>每次以代碼登入時更新 {@code last_login_at}</li>
 *   <li>不會被刪除</li>
 * </ul>
 *
 * <p>尚未設定的欄位不寫入文件（而非寫成 {@code null}）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialRecord(
    String code,
    @JsonProperty("created_at") Instant createdAt,
    String token,
    @JsonProperty("token_generated_at") Instant tokenGeneratedAt,
    @JsonProperty("last_login_at") Instant lastLoginAt
) {
    /**
     * 建立新發放的憑證紀錄。
     *
     * @param code 6 碼代碼
     * @param now 建立時間
     * @return 尚未有 token 的紀錄
     */
    public static CredentialRecord create(String code, Instant now) {
        return new CredentialRecord(code, now, null, null, null);
    }

    @JsonIgnore
    public boolean hasToken() {
        return token != null;
    }

    public CredentialRecord withToken(String newToken, Instant now) {
        return new CredentialRecord(code, createdAt, newToken, now, lastLoginAt);
    }

    public CredentialRecord withLastLogin(Instant now) {
        return new CredentialRecord(code, createdAt, token, tokenGeneratedAt, now);
    }
}
