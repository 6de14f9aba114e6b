package dev.smellscope.domain.valueobject;

import dev.smellscope.domain.enums.BackendState;

/**
 * How a detector slot resolved. {@code reason} is null on success.
 */
public record BackendStatus(BackendState state, String reason) {

    public BackendStatus {
        if (state == null) throw new IllegalArgumentException("state required");
    }

    public static BackendStatus success() {
        return new BackendStatus(BackendState.SUCCESS, null);
    }

    public static BackendStatus failure(String reason) {
        return new BackendStatus(BackendState.FAILURE, reason);
    }

    public static BackendStatus timeout(String reason) {
        return new BackendStatus(BackendState.TIMEOUT, reason);
    }

    public static BackendStatus skipped(String reason) {
        return new BackendStatus(BackendState.SKIPPED, reason);
    }

    public boolean isSuccess() {
        return state == BackendState.SUCCESS;
    }

    public boolean wasAttempted() {
        return state != BackendState.SKIPPED;
    }
}
