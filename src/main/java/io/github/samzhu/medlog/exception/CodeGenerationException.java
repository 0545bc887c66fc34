package io.github.samzhu.medlog.exception;

/**
 * 連續多次產生的代碼都與既有代碼碰撞，放棄發放。
 */
public class CodeGenerationException extends RuntimeException {

    private final int attempts;

    public CodeGenerationException(int attempts) {
        super(String.format("Could not generate a unique code after %d attempts", attempts));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
