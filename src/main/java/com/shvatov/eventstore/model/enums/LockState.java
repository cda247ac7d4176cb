package com.shvatov.eventstore.model.enums;

public enum LockState {
    UNLOCKED,
    LOCKED
}
