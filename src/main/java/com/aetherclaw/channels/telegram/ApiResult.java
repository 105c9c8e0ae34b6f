package com.aetherclaw.channels.telegram;

/**
 * Outcome of one Bot API call. Either {@code value} is set, or {@code error} describes the
 * failure; {@code statusCode} is the error code Telegram answered with, 0 when there was none.
 */
public record ApiResult<T>(T value, int statusCode, String error) {

    public static <T> ApiResult<T> ok(T value) {
        return new ApiResult<>(value, 200, null);
    }

    public static <T> ApiResult<T> failure(int statusCode, String error) {
        return new ApiResult<>(null, statusCode, error != null ? error : "unknown error");
    }

    public boolean isOk() {
        return error == null;
    }

    /** Telegram answers 401 for a revoked token and 404 for a malformed one. */
    public boolean isAuthRejected() {
        return statusCode == 401 || statusCode == 404;
    }
}
