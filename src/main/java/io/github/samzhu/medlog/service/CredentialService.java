package io.github.samzhu.medlog.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import io.github.samzhu.medlog.config.MedlogProperties;
import io.github.samzhu.medlog.document.CredentialRecord;
import io.github.samzhu.medlog.exception.CodeGenerationException;
import io.github.samzhu.medlog.repository.SnapshotTemplate;
import io.github.samzhu.medlog.repository.StoreUpdate;
import io.github.samzhu.medlog.util.CodeMasking;

/**
 * 憑證管理服務：發放代碼、以代碼換發 token、驗證 token 與代碼。
 *
 * <p>流程：
 * <ol>
 *   <li>{@link #issueCode()} 產生 6 碼代碼（{@code [A-Z0-9]}）並建立憑證紀錄</li>
 *   <li>{@link #issueToken(String)} 以代碼換發 64 字元十六進位 token，每個代碼只會產生一次</li>
 *   <li>{@link #resolveToken(String)} 由 bearer token 找回代碼，是 API 層唯一需要的驗證原語</li>
 * </ol>
 *
 * <p>找不到代碼或 token 屬於一般結果（{@link Optional#empty()} / {@code false}），不拋例外。
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int CODE_LENGTH = 6;
    static final int TOKEN_BYTES = 32;

    private final SnapshotTemplate template;
    private final Clock clock;
    private final Random random;
    private final int maxCodeAttempts;

    @Autowired
    public CredentialService(SnapshotTemplate template, Clock clock, MedlogProperties properties) {
        this(template, clock, new SecureRandom(), properties.credential().maxCodeAttempts());
    }

    CredentialService(SnapshotTemplate template, Clock clock, Random random, int maxCodeAttempts) {
        this.template = template;
        this.clock = clock;
        this.random = random;
        this.maxCodeAttempts = maxCodeAttempts;
    }

    /**
     * 發放新代碼。
     *
     * <p>與既有代碼碰撞時重新產生，最多嘗試 {@code maxCodeAttempts} 次。
     *
     * @return 新代碼
     * @throws CodeGenerationException 所有嘗試都碰撞
     */
    public String issueCode() {
        String code = template.update(snapshot -> {
            List<CredentialRecord> codes = snapshot.codes();
            for (int attempt = 1; attempt <= maxCodeAttempts; attempt++) {
                String candidate = generateCode();
                if (findByCode(codes, candidate).isEmpty()) {
                    codes.add(CredentialRecord.create(candidate, now()));
                    return StoreUpdate.write(candidate);
                }
                log.warn("Generated code collided with an existing code, re-rolling: attempt={}", attempt);
            }
            throw new CodeGenerationException(maxCodeAttempts);
        });
        log.info("Code issued: code={}", CodeMasking.mask(code));
        return code;
    }

    /**
     * 以代碼登入，成功時更新 {@code last_login_at}。
     *
     * @param code 用戶代碼
     * @return 代碼存在時為 true
     */
    public boolean authenticateByCode(String code) {
        boolean found = template.update(snapshot -> {
            List<CredentialRecord> codes = snapshot.codes();
            int index = indexOfCode(codes, code);
            if (index < 0) {
                return StoreUpdate.unchanged(false);
            }
            codes.set(index, codes.get(index).withLastLogin(now()));
            return StoreUpdate.write(true);
        });
        if (found) {
            log.info("Login by code succeeded: code={}", CodeMasking.mask(code));
        } else {
            log.debug("Login by code failed, unknown code: code={}", CodeMasking.mask(code));
        }
        return found;
    }

    /**
     * 以代碼換發 token。
     *
     * <p>已有 token 時原樣回傳且不寫入；否則以 {@link SecureRandom} 產生 256-bit token。
     *
     * @param code 用戶代碼
     * @return token；代碼不存在時為 empty
     */
    public Optional<String> issueToken(String code) {
        return template.update(snapshot -> {
            List<CredentialRecord> codes = snapshot.codes();
            int index = indexOfCode(codes, code);
            if (index < 0) {
                log.debug("Token request for unknown code: code={}", CodeMasking.mask(code));
                return StoreUpdate.unchanged(Optional.<String>empty());
            }
            CredentialRecord record = codes.get(index);
            if (record.hasToken()) {
                log.debug("Token already issued, returning existing token: code={}", CodeMasking.mask(code));
                return StoreUpdate.unchanged(Optional.of(record.token()));
            }
            String token = generateToken();
            codes.set(index, record.withToken(token, now()));
            log.info("Token issued: code={}", CodeMasking.mask(code));
            return StoreUpdate.write(Optional.of(token));
        });
    }

    /**
     * 由 bearer token 找回所屬代碼。比對區分大小寫。
     *
     * @param token bearer token
     * @return 代碼；token 無效時為 empty
     */
    public Optional<String> resolveToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return template.read(snapshot -> snapshot.codes().stream()
            .filter(record -> token.equals(record.token()))
            .map(CredentialRecord::code)
            .findFirst());
    }

    /**
     * 代碼是否存在，供代碼驗證的備援路徑使用。
     */
    public boolean codeExists(String code) {
        return template.read(snapshot -> findByCode(snapshot.codes(), code).isPresent());
    }

    private String generateCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private Instant now() {
        return clock.instant();
    }

    private static Optional<CredentialRecord> findByCode(List<CredentialRecord> codes, String code) {
        return codes.stream().filter(record -> record.code().equals(code)).findFirst();
    }

    private static int indexOfCode(List<CredentialRecord> codes, String code) {
        for (int i = 0; i < codes.size(); i++) {
            if (codes.get(i).code().equals(code)) {
                return i;
            }
        }
        return -1;
    }
}
