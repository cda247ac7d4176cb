package com.shvatov.eventstore.exception;

import com.shvatov.eventstore.model.LockKey;
import com.shvatov.eventstore.model.enums.ApplockResult;
import lombok.Getter;

import java.util.Optional;

public class LockReleaseException extends EventStoreException {
    @Getter
    private final LockKey lockKey;
    private final ApplockResult result;

    public LockReleaseException(final LockKey lockKey, final ApplockResult result) {
        super("failed to unlock %s: release returned %s".formatted(lockKey, result));
        this.lockKey = lockKey;
        this.result = result;
    }

    public LockReleaseException(final LockKey lockKey, final Throwable cause) {
        super("failed to unlock %s: %s".formatted(lockKey, cause.getMessage()), cause);
        this.lockKey = lockKey;
        this.result = null;
    }

    public Optional<ApplockResult> getResult() {
        return Optional.ofNullable(result);
    }
}
