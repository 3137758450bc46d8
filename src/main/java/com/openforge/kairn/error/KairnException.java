package com.openforge.kairn.error;

import lombok.Getter;

/**
 * The one exception type the core throws. Carries an {@link ErrorKind} so the
 * transport can report it verbatim as {@code {kind, message}}.
 */
@Getter
public class KairnException extends RuntimeException {

    private final ErrorKind kind;

    public KairnException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KairnException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    // ── Static factory helpers ───────────────────────────────────────────────

    public static KairnException notFound(String message) {
        return new KairnException(ErrorKind.NOT_FOUND, message);
    }

    public static KairnException invalidArgument(String message) {
        return new KairnException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static KairnException conflict(String message) {
        return new KairnException(ErrorKind.CONFLICT, message);
    }

    public static KairnException storeFailure(String message, Throwable cause) {
        return new KairnException(ErrorKind.STORE_FAILURE, message, cause);
    }
}
