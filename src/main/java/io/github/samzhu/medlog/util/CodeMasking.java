package io.github.samzhu.medlog.util;

/**
 * 記錄用的代碼遮罩。
 *
 * <p>代碼可直接換發 token，等同憑證，日誌中只保留前 2 碼。
 */
public final class CodeMasking {

    private static final int VISIBLE_CHARS = 2;

    private CodeMasking() {
    }

    /**
     * @param code 用戶代碼，可為 null
     * @return 例如 {@code AB****}；null 時為 {@code "null"}
     */
    public static String mask(String code) {
        if (code == null) {
            return "null";
        }
        if (code.length() <= VISIBLE_CHARS) {
            return "*".repeat(code.length());
        }
        return code.substring(0, VISIBLE_CHARS) + "*".repeat(code.length() - VISIBLE_CHARS);
    }
}
