package com.shvatov.eventstore.service.lock;

import com.shvatov.eventstore.exception.AlreadyLockedException;
import com.shvatov.eventstore.exception.LockAcquireException;
import com.shvatov.eventstore.exception.LockReleaseException;
import com.shvatov.eventstore.model.LockKey;
import com.shvatov.eventstore.model.enums.LockState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;

@Slf4j
public abstract class AbstractAdvisoryLockManager {
    protected final JdbcOperations jdbcTemplate;

    @Getter
    private final String databaseName;
    @Getter
    private final String schemaName;
    @Getter
    private final LockKey lockKey;
    @Getter
    private LockState state = LockState.UNLOCKED;

    protected AbstractAdvisoryLockManager(final JdbcOperations jdbcTemplate,
                                          final String databaseName,
                                          final String schemaName) {
        this.jdbcTemplate = jdbcTemplate;
        this.databaseName = databaseName;
        this.schemaName = schemaName;
        this.lockKey = LockKeyGenerator.generate(databaseName, schemaName);
    }

    public void acquire() {
        if (isLocked()) {
            throw new AlreadyLockedException(lockKey);
        }

        log.info(
                "Attempting to acquire lock {} for the database \"{}\" and schema \"{}\"",
                lockKey, databaseName, schemaName
        );
        try {
            doAcquireLock(lockKey);
        } catch (final DataAccessException exception) {
            throw new LockAcquireException(lockKey, exception);
        }
        state = LockState.LOCKED;
        log.info("Acquired lock {}", lockKey);
    }

    public void release() {
        if (!isLocked()) {
            return;
        }

        log.info("Releasing lock {}", lockKey);
        try {
            doReleaseLock(lockKey);
        } catch (final DataAccessException exception) {
            throw new LockReleaseException(lockKey, exception);
        }
        state = LockState.UNLOCKED;
        log.info("Released lock {}", lockKey);
    }

    public boolean isLocked() {
        return state == LockState.LOCKED;
    }

    protected abstract void doAcquireLock(final LockKey key);

    protected abstract void doReleaseLock(final LockKey key);
}
