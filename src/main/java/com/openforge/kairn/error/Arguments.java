package com.openforge.kairn.error;

/**
 * Argument checks shared by the engines. Every failure is an INVALID_ARGUMENT.
 */
public final class Arguments {

    public static final int MAX_LIMIT = 50;
    public static final int MAX_DEPTH = 5;

    private Arguments() {
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw KairnException.invalidArgument(field + " is required");
        }
        return value.trim();
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw KairnException.invalidArgument(field + " is required");
        }
        return value;
    }

    public static int requireLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw KairnException.invalidArgument("limit must be between 1 and " + MAX_LIMIT + ", got " + limit);
        }
        return limit;
    }

    public static int requireOffset(int offset) {
        if (offset < 0) {
            throw KairnException.invalidArgument("offset must be >= 0, got " + offset);
        }
        return offset;
    }

    public static int requireDepth(int depth) {
        if (depth < 1 || depth > MAX_DEPTH) {
            throw KairnException.invalidArgument("depth must be between 1 and " + MAX_DEPTH + ", got " + depth);
        }
        return depth;
    }

    /** Checks a weight, relevance or threshold value against [0, 1]. */
    public static double requireUnitInterval(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw KairnException.invalidArgument(field + " must be between 0.0 and 1.0, got " + value);
        }
        return value;
    }

    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
