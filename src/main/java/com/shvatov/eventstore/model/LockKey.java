package com.shvatov.eventstore.model;

public record LockKey(int value) {
    public String resourceName() {
        return Integer.toUnsignedString(value);
    }

    @Override
    public String toString() {
        return resourceName();
    }
}
