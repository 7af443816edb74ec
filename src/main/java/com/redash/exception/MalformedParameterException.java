package com.redash.exception;

/**
 * Raised when a parameter cannot be bound, either because its header ({@code name},
 * {@code type}) is unreadable or because its payload does not fit the shape its kind
 * requires. The tag is {@code null} when the header itself could not be read.
 */
public class MalformedParameterException extends ParameterException {

    private final String tag;

    public MalformedParameterException(int index, String tag, String reason, Throwable cause) {
        super(index, "Malformed parameter at index " + index
                + (tag != null ? " (type '" + tag + "')" : "") + ": " + reason, cause);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
