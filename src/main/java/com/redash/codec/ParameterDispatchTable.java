package com.redash.codec;

import com.redash.exception.UnknownParameterKindException;
import com.redash.model.parameter.ParameterKind;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maps the {@code type} tag found on the wire to the {@link ParameterKind} it names.
 * <p>
 * The table is built once when the class is loaded and is never modified afterwards, so it
 * can be read from any number of threads without synchronization.
 */
public final class ParameterDispatchTable {

    private static final Map<String, ParameterKind> KINDS_BY_TAG = Map.copyOf(Arrays.stream(ParameterKind.values())
            .collect(Collectors.toMap(ParameterKind::getTag, Function.identity())));

    private ParameterDispatchTable() {
    }

    /**
     * Looks up the kind for a wire tag.
     *
     * @param tag The value of the {@code type} field.
     * @return The matching kind.
     * @throws UnknownParameterKindException if the tag is {@code null} or not one of the supported tags.
     */
    public static ParameterKind resolve(String tag) {
        return resolve(tag, -1);
    }

    /**
     * Looks up the kind for the tag of the parameter at {@code index} in a collection.
     *
     * @param tag   The value of the {@code type} field.
     * @param index The position reported if the tag is unknown.
     * @return The matching kind.
     * @throws UnknownParameterKindException if the tag is {@code null} or not one of the supported tags.
     */
    public static ParameterKind resolve(String tag, int index) {
        ParameterKind kind = tag == null ? null : KINDS_BY_TAG.get(tag);
        if (kind == null) {
            throw new UnknownParameterKindException(index, tag);
        }
        return kind;
    }
}
