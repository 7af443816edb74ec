package com.redash.model.parameter;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rendering options for a selection that allows several values, e.g. prefix {@code '},
 * suffix {@code '} and separator {@code ,} to produce {@code 'a','b'}.
 * <p>
 * Its presence on a parameter is what makes the wire {@code value} an array instead of a
 * single string.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MultiValuesOptions {

    private String prefix;

    private String suffix;

    private String separator;
}
