package com.shvatov.eventstore.exception;

import com.shvatov.eventstore.model.LockKey;
import lombok.Getter;

@Getter
public class AlreadyLockedException extends EventStoreException {
    private final LockKey lockKey;

    public AlreadyLockedException(final LockKey lockKey) {
        super("can't acquire lock: lock %s is already held by this session".formatted(lockKey));
        this.lockKey = lockKey;
    }
}
