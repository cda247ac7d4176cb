package com.shvatov.eventstore.exception;

public class EventStoreConnectionException extends EventStoreException {
    public EventStoreConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
