package com.shvatov.eventstore.exception;

public class NoSchemaException extends EventStoreException {
    public NoSchemaException() {
        super("no schema");
    }
}
