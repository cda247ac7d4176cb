package com.shvatov.eventstore.service.session;

import com.shvatov.eventstore.config.EventStoreProperties;
import com.shvatov.eventstore.exception.EventStoreConnectionException;
import com.shvatov.eventstore.exception.LockReleaseException;
import com.shvatov.eventstore.exception.NoDatabaseNameException;
import com.shvatov.eventstore.exception.NoSchemaException;
import com.shvatov.eventstore.model.EventStoreColumn;
import com.shvatov.eventstore.service.lock.AbstractAdvisoryLockManager;
import com.shvatov.eventstore.service.lock.SqlServerAdvisoryLockManager;
import com.shvatov.eventstore.service.schema.EventStoreSchemaInitializer;
import com.shvatov.eventstore.utils.JdbcTemplateUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class EventStoreSessionFactory {
    static final String CURRENT_DATABASE_QUERY = "select DB_NAME()";
    static final String CURRENT_SCHEMA_QUERY = "select SCHEMA_NAME()";

    private final DataSource dataSource;
    private final EventStoreProperties properties;

    public EventStoreSession open() {
        final var connection = obtainConnection();
        try {
            return open(connection);
        } catch (final RuntimeException exception) {
            discardAfterFailedOpen(connection, exception);
            throw exception;
        }
    }

    // on failure the connection stays the caller's, abort it if a LockReleaseException is reported
    public EventStoreSession open(final Connection connection) {
        return open(connection, createJdbcTemplate(connection));
    }

    JdbcTemplate createJdbcTemplate(final Connection connection) {
        return new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    EventStoreSession open(final Connection connection, final JdbcTemplate jdbcTemplate) {
        final var databaseName = resolveName(jdbcTemplate, CURRENT_DATABASE_QUERY)
                .orElseThrow(NoDatabaseNameException::new);
        final var schemaName = resolveName(jdbcTemplate, CURRENT_SCHEMA_QUERY)
                .orElseThrow(NoSchemaException::new);
        final var tableName = resolveTableName();
        log.info(
                "Opening event store session for the database \"{}\", schema \"{}\" and table \"{}\"",
                databaseName, schemaName, tableName
        );

        final var lockManager = new SqlServerAdvisoryLockManager(
                jdbcTemplate, databaseName, schemaName, properties.getLockTimeout()
        );
        final var schemaInitializer = new EventStoreSchemaInitializer(
                jdbcTemplate, schemaName, properties.isCreateDispatchIndex()
        );
        final var tableCreated = ensureTable(lockManager, schemaInitializer, tableName);

        return new EventStoreSession(connection, jdbcTemplate, databaseName, schemaName, tableName, tableCreated);
    }

    boolean ensureTable(final AbstractAdvisoryLockManager lockManager,
                        final EventStoreSchemaInitializer schemaInitializer,
                        final String tableName) {
        lockManager.acquire();

        RuntimeException failure = null;
        try {
            return schemaInitializer.ensure(tableName);
        } catch (final RuntimeException exception) {
            failure = exception;
            throw exception;
        } finally {
            releaseLock(lockManager, failure);
        }
    }

    private void releaseLock(final AbstractAdvisoryLockManager lockManager, final RuntimeException failure) {
        try {
            lockManager.release();
        } catch (final RuntimeException exception) {
            if (Objects.nonNull(failure)) {
                log.error("Failed to release lock {} after a failed table initialization", lockManager.getLockKey(), exception);
                failure.addSuppressed(exception);
                return;
            }
            log.warn(
                    "Event store table is in place but lock {} may still be held by this connection",
                    lockManager.getLockKey(), exception
            );
            throw exception;
        }
    }

    private Optional<String> resolveName(final JdbcTemplate jdbcTemplate, final String query) {
        try {
            return JdbcTemplateUtils.querySingleNonBlank(jdbcTemplate, query);
        } catch (final DataAccessException exception) {
            throw new EventStoreConnectionException(
                    "failed to resolve connection context with \"%s\"".formatted(query),
                    exception
            );
        }
    }

    private String resolveTableName() {
        final var tableName = properties.getTableName();
        if (Objects.isNull(tableName) || tableName.isBlank()) {
            return EventStoreColumn.DEFAULT_TABLE_NAME;
        }
        return tableName;
    }

    private Connection obtainConnection() {
        try {
            return dataSource.getConnection();
        } catch (final SQLException exception) {
            throw new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection", exception);
        }
    }

    private void discardAfterFailedOpen(final Connection connection, final RuntimeException failure) {
        if (isLockPossiblyHeld(failure)) {
            // a pooled close keeps the server session, and with it the applock, alive
            log.warn("Aborting connection, the applock of the failed session may still be held");
            try {
                connection.abort(Runnable::run);
            } catch (final SQLException exception) {
                failure.addSuppressed(exception);
            }
        }

        try {
            connection.close();
        } catch (final SQLException exception) {
            failure.addSuppressed(exception);
        }
    }

    static boolean isLockPossiblyHeld(final RuntimeException failure) {
        return failure instanceof LockReleaseException
                || Arrays.stream(failure.getSuppressed()).anyMatch(LockReleaseException.class::isInstance);
    }
}
