package com.shvatov.eventstore.exception;

public class SchemaInitException extends EventStoreException {
    public SchemaInitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
