package com.shvatov.eventstore.exception;

public class NoDatabaseNameException extends EventStoreException {
    public NoDatabaseNameException() {
        super("no database name");
    }
}
