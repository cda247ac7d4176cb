package com.shvatov.eventstore.exception;

import com.shvatov.eventstore.model.LockKey;
import com.shvatov.eventstore.model.enums.ApplockResult;
import lombok.Getter;

import java.util.Optional;

public class LockAcquireException extends EventStoreException {
    @Getter
    private final LockKey lockKey;
    private final ApplockResult result;

    public LockAcquireException(final LockKey lockKey, final ApplockResult result) {
        super("try lock failed: lock %s was not granted (%s)".formatted(lockKey, result));
        this.lockKey = lockKey;
        this.result = result;
    }

    public LockAcquireException(final LockKey lockKey, final Throwable cause) {
        super("try lock failed: %s".formatted(cause.getMessage()), cause);
        this.lockKey = lockKey;
        this.result = null;
    }

    public Optional<ApplockResult> getResult() {
        return Optional.ofNullable(result);
    }
}
