package com.certprep.rag.exception;

import lombok.Getter;

/**
 * A vector's length disagrees with the dimension the index was configured with.
 *
 * <p>This is a deployment error (wrong embedding model or wrong corpus file) and is
 * never recovered from.
 */
@Getter
public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String context, int expected, int actual) {
        super(String.format("%s: expected dimension %d but got %d", context, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public static void check(String context, int expected, int actual) {
        if (expected != actual) {
            throw new DimensionMismatchException(context, expected, actual);
        }
    }

}
