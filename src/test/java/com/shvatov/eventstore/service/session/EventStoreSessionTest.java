package com.shvatov.eventstore.service.session;

import com.shvatov.eventstore.exception.CloseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class EventStoreSessionTest {
    private Connection connection;
    private EventStoreSession session;

    @BeforeEach
    void setUp() {
        connection = mock(Connection.class);
        session = new EventStoreSession(
                connection, mock(JdbcTemplate.class), "test", "test_schema", "event_store", false
        );
    }

    @Test
    @DisplayName("close releases the connection exactly once")
    void testClose() throws SQLException {
        session.close();
        session.close();

        assertTrue(session.isClosed());
        verify(connection, times(1)).close();
    }

    @Test
    @DisplayName("close failure is wrapped and not retried")
    void testCloseFailure() throws SQLException {
        final var cause = new SQLException("network error");
        doThrow(cause).when(connection).close();

        final var exception = assertThrows(CloseException.class, session::close);
        session.close();

        assertSame(cause, exception.getCause());
        assertTrue(exception.getMessage().startsWith("failed to close connection"));
        verify(connection, times(1)).close();
    }
}
