package com.redash.exception;

/**
 * Raised when a single-select {@code enum} or {@code query} parameter is encoded
 * without any selected value.
 */
public class EmptySingleSelectionException extends ParameterException {

    public EmptySingleSelectionException(int index) {
        super(index, "Parameter at index " + index + " is single-select but has no selected value");
    }
}
