package com.shvatov.eventstore.exception;

public class CloseException extends EventStoreException {
    public CloseException(final Throwable cause) {
        super("failed to close connection: %s".formatted(cause.getMessage()), cause);
    }
}
