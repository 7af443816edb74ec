package com.redash.exception;

/**
 * Raised when a parameter's {@code type} tag does not name one of the supported kinds.
 */
public class UnknownParameterKindException extends ParameterException {

    private final String tag;

    /**
     * @param index The position of the parameter in its collection, or {@code -1} when not known.
     * @param tag   The unrecognized tag, may be {@code null}.
     */
    public UnknownParameterKindException(int index, String tag) {
        super(index, "Unknown parameter kind '" + tag + "'" + (index >= 0 ? " at index " + index : ""));
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
