package com.shvatov.eventstore.service.schema;

import com.shvatov.eventstore.exception.SchemaInitException;
import com.shvatov.eventstore.model.EventStoreColumn;
import com.shvatov.eventstore.utils.SqlIdentifiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcOperations;

import java.util.Objects;

// callers must hold the schema lock
@Slf4j
@RequiredArgsConstructor
public class EventStoreSchemaInitializer {
    public static final String TABLE_EXISTS_QUERY = """
            select count(*) from sys.tables t
                join sys.schemas s on s.schema_id = t.schema_id
                where s.name = ? and t.name = ?""";
    public static final String INDEX_EXISTS_QUERY = """
            select count(*) from sys.indexes i
                join sys.tables t on t.object_id = i.object_id
                join sys.schemas s on s.schema_id = t.schema_id
                where s.name = ? and t.name = ? and i.name = ?""";

    private final JdbcOperations jdbcTemplate;
    private final String schemaName;
    private final boolean createDispatchIndex;

    public boolean ensure(final String tableName) {
        SqlIdentifiers.requireValid(tableName, "Table");
        final var indexName = dispatchIndexName(tableName);
        if (createDispatchIndex) {
            SqlIdentifiers.requireValid(indexName, "Index");
        }

        final var created = !tableExists(tableName);
        if (created) {
            createTable(tableName);
        } else {
            log.info("Table {}.{} already exists, skipping creation", schemaName, tableName);
        }

        // checked on every run, a previous run may have failed between the two statements
        if (createDispatchIndex && !indexExists(tableName, indexName)) {
            createDispatchIndex(indexName, tableName);
        }
        return created;
    }

    static String dispatchIndexName(final String tableName) {
        return "ix_%s_dispatched".formatted(tableName);
    }

    private boolean indexExists(final String tableName, final String indexName) {
        try {
            final var count = jdbcTemplate.queryForObject(
                    INDEX_EXISTS_QUERY, Integer.class, schemaName, tableName, indexName
            );
            return Objects.nonNull(count) && count > 0;
        } catch (final DataAccessException exception) {
            throw new SchemaInitException(
                    "failed to check existence of index %s on %s.%s".formatted(indexName, schemaName, tableName),
                    exception
            );
        }
    }

    private boolean tableExists(final String tableName) {
        try {
            final var count = jdbcTemplate.queryForObject(TABLE_EXISTS_QUERY, Integer.class, schemaName, tableName);
            return Objects.nonNull(count) && count > 0;
        } catch (final DataAccessException exception) {
            throw new SchemaInitException(
                    "failed to check existence of table %s.%s".formatted(schemaName, tableName),
                    exception
            );
        }
    }

    private void createTable(final String tableName) {
        log.info("Creating table {}.{}", schemaName, tableName);
        try {
            jdbcTemplate.execute(createTableStatement(tableName));
        } catch (final DataAccessException exception) {
            throw new SchemaInitException(
                    "failed to create table %s.%s".formatted(schemaName, tableName),
                    exception
            );
        }
        log.info("Created table {}.{}", schemaName, tableName);
    }

    private void createDispatchIndex(final String indexName, final String tableName) {
        log.info("Creating index {} on {}.{}", indexName, schemaName, tableName);
        try {
            jdbcTemplate.execute(createDispatchIndexStatement(indexName, tableName));
        } catch (final DataAccessException exception) {
            throw new SchemaInitException(
                    "failed to create index %s on %s.%s".formatted(indexName, schemaName, tableName),
                    exception
            );
        }
    }

    String createTableStatement(final String tableName) {
        return "create table %s %s".formatted(
                SqlIdentifiers.qualify(schemaName, tableName),
                EventStoreColumn.tableDefinition()
        );
    }

    String createDispatchIndexStatement(final String indexName, final String tableName) {
        return "create index %s on %s (%s, %s)".formatted(
                SqlIdentifiers.quote(indexName),
                SqlIdentifiers.qualify(schemaName, tableName),
                EventStoreColumn.DISPATCHED.getColumnName(),
                EventStoreColumn.DISPATCHED_AT.getColumnName()
        );
    }
}
