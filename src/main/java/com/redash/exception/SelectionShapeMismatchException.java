package com.redash.exception;

/**
 * Raised when the wire {@code value} of an {@code enum} or {@code query} parameter does not
 * have the shape predicted by the presence or absence of {@code multiValuesOptions}.
 */
public class SelectionShapeMismatchException extends ParameterException {

    private final String expectedShape;

    public SelectionShapeMismatchException(int index, String expectedShape, String actualShape) {
        super(index, "Parameter at index " + index + " expected a value of shape '" + expectedShape
                + "' but found '" + actualShape + "'");
        this.expectedShape = expectedShape;
    }

    public String getExpectedShape() {
        return expectedShape;
    }
}
