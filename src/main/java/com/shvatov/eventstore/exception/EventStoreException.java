package com.shvatov.eventstore.exception;

public abstract class EventStoreException extends RuntimeException {
    protected EventStoreException(final String message) {
        super(message);
    }

    protected EventStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
