package com.openforge.kairn.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structured error classes returned by every core operation.
 *
 * NOT_FOUND        — referenced node / edge / experience is absent or soft-deleted
 * INVALID_ARGUMENT — malformed enum value, out-of-range weight/limit/depth, missing field
 * CONFLICT         — a strict operation hit an existing state (e.g. restoring a live node)
 * STORE_FAILURE    — the persistent store rejected or timed out the transaction
 */
public enum ErrorKind {
    NOT_FOUND("NotFound"),
    INVALID_ARGUMENT("InvalidArgument"),
    CONFLICT("Conflict"),
    STORE_FAILURE("StoreFailure");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
