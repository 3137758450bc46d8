package com.openforge.kairn.error;

/**
 * Error body returned by every endpoint: {@code {"kind": "NotFound", "message": "..."}}.
 */
public record ApiError(
        ErrorKind kind,
        String    message
) {}
