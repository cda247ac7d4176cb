package com.shvatov.eventstore.service.session;

import com.shvatov.eventstore.exception.CloseException;
import com.shvatov.eventstore.model.EventStoreColumn;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

// owns its connection exclusively, not thread-safe
@Slf4j
@Getter
public class EventStoreSession implements AutoCloseable {
    private final Connection connection;
    private final JdbcTemplate jdbcTemplate;
    private final String databaseName;
    private final String schemaName;
    private final String tableName;
    private final boolean tableCreated;
    private boolean closed;

    EventStoreSession(final Connection connection,
                      final JdbcTemplate jdbcTemplate,
                      final String databaseName,
                      final String schemaName,
                      final String tableName,
                      final boolean tableCreated) {
        this.connection = connection;
        this.jdbcTemplate = jdbcTemplate;
        this.databaseName = databaseName;
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.tableCreated = tableCreated;
    }

    public List<EventStoreColumn> getColumns() {
        return List.of(EventStoreColumn.values());
    }

    // a second call is a no-op
    @Override
    public void close() {
        if (closed) {
            log.debug("Session for {}.{} is already closed", databaseName, schemaName);
            return;
        }

        closed = true;
        try {
            connection.close();
        } catch (final SQLException exception) {
            throw new CloseException(exception);
        }
        log.info("Closed session for {}.{}", databaseName, schemaName);
    }
}
