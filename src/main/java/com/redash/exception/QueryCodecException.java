package com.redash.exception;

/**
 * The root of all errors raised while encoding or decoding a query definition.
 * <p>
 * Every failure of the parameter codec is reported to the immediate caller of the
 * collection-level operation through a subclass of this exception. The exception is
 * unchecked so that it can travel through Jackson callbacks and Spring proxies
 * without being wrapped.
 */
public class QueryCodecException extends RuntimeException {

    /**
     * Constructs a new QueryCodecException with the specified detail message.
     *
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public QueryCodecException(String message) {
        super(message);
    }

    /**
     * Constructs a new QueryCodecException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying failure, typically a Jackson {@code JsonProcessingException}.
     *                A {@code null} value is permitted.
     */
    public QueryCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
