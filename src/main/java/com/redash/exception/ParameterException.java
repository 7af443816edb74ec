package com.redash.exception;

/**
 * A codec failure tied to one element of a parameter collection.
 * The index is the element's zero-based position in the {@code parameters} array.
 */
public abstract class ParameterException extends QueryCodecException {

    private final int index;

    protected ParameterException(int index, String message) {
        super(message);
        this.index = index;
    }

    protected ParameterException(int index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    /**
     * @return The zero-based position of the offending parameter within its collection.
     */
    public int getIndex() {
        return index;
    }
}
