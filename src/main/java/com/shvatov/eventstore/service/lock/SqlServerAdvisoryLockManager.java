package com.shvatov.eventstore.service.lock;

import com.shvatov.eventstore.exception.LockAcquireException;
import com.shvatov.eventstore.exception.LockReleaseException;
import com.shvatov.eventstore.model.LockKey;
import com.shvatov.eventstore.model.enums.ApplockResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.CallableStatementCallback;
import org.springframework.jdbc.core.JdbcOperations;

import java.sql.Types;
import java.time.Duration;
import java.util.Objects;

@Slf4j
public class SqlServerAdvisoryLockManager extends AbstractAdvisoryLockManager {
    public static final String GET_APPLOCK_CALL = "{? = call sp_getapplock(?, ?, ?, ?)}";
    public static final String RELEASE_APPLOCK_CALL = "{? = call sp_releaseapplock(?, ?)}";
    static final int WAIT_INDEFINITELY = -1;
    private static final int RELEASED = 0;

    private static final String LOCK_MODE = "Exclusive";
    private static final String LOCK_OWNER = "Session";

    private final Duration lockTimeout;

    public SqlServerAdvisoryLockManager(final JdbcOperations jdbcTemplate,
                                        final String databaseName,
                                        final String schemaName,
                                        final Duration lockTimeout) {
        super(jdbcTemplate, databaseName, schemaName);
        this.lockTimeout = lockTimeout;
    }

    @Override
    protected void doAcquireLock(final LockKey key) {
        final var timeoutMillis = lockTimeoutMillis();
        log.debug("Calling sp_getapplock for resource {} with timeout = {} ms", key, timeoutMillis);

        final var result = ApplockResult.fromCode(
                jdbcTemplate.execute(
                        GET_APPLOCK_CALL,
                        (CallableStatementCallback<Integer>) cs -> {
                            cs.registerOutParameter(1, Types.INTEGER);
                            cs.setString(2, key.resourceName());
                            cs.setString(3, LOCK_MODE);
                            cs.setString(4, LOCK_OWNER);
                            cs.setInt(5, timeoutMillis);
                            cs.execute();
                            return cs.getInt(1);
                        }
                )
        );

        if (!result.isSuccess()) {
            throw new LockAcquireException(key, result);
        }
    }

    @Override
    protected void doReleaseLock(final LockKey key) {
        final var result = ApplockResult.fromCode(
                jdbcTemplate.execute(
                        RELEASE_APPLOCK_CALL,
                        (CallableStatementCallback<Integer>) cs -> {
                            cs.registerOutParameter(1, Types.INTEGER);
                            cs.setString(2, key.resourceName());
                            cs.setString(3, LOCK_OWNER);
                            cs.execute();
                            return cs.getInt(1);
                        }
                )
        );

        if (result.getCode() != RELEASED) {
            throw new LockReleaseException(key, result);
        }
    }

    int lockTimeoutMillis() {
        if (Objects.isNull(lockTimeout) || lockTimeout.isNegative()) {
            return WAIT_INDEFINITELY;
        }
        return (int) Math.min(lockTimeout.toMillis(), Integer.MAX_VALUE);
    }
}
