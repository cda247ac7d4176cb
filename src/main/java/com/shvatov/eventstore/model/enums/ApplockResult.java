package com.shvatov.eventstore.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

// return codes of sp_getapplock / sp_releaseapplock
@Getter
@RequiredArgsConstructor
public enum ApplockResult {
    GRANTED(0, true),
    GRANTED_AFTER_WAIT(1, true),
    TIMEOUT(-1, false),
    CANCELED(-2, false),
    DEADLOCK_VICTIM(-3, false),
    CALL_ERROR(-999, false);

    private final int code;
    private final boolean success;

    public static ApplockResult fromCode(final Integer code) {
        if (code == null) {
            return CALL_ERROR;
        }
        return Arrays.stream(values())
                .filter(result -> result.code == code)
                .findFirst()
                .orElse(code >= 0 ? GRANTED : CALL_ERROR);
    }
}
