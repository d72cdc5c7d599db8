package com.wshg.catalog.error;

/**
 * Thrown when a vector's dimensions don't match the store configuration.
 */
public class VectorDimensionMismatchException extends PersistenceException {

    private final int expected;
    private final int actual;

    public VectorDimensionMismatchException(int expected, int actual) {
        super("Dimension mismatch: expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
        detail("expected", expected);
        detail("actual", actual);
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
