package io.github.samzhu.medlog.dto.api;

/**
 * 簡單狀態回應，例如 {@code {"status": "saved"}}。
 */
public record StatusResponse(String status) {

    public static StatusResponse ok() {
        return new StatusResponse("ok");
    }

    public static StatusResponse saved() {
        return new StatusResponse("saved");
    }

    public static StatusResponse skipped() {
        return new StatusResponse("skipped");
    }
}
