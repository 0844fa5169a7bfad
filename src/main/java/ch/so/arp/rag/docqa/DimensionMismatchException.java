package ch.so.arp.rag.docqa;

/**
 * Raised when a vector does not have the dimension of the index it is added to
 * or searched against.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Expected vector of dimension " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
