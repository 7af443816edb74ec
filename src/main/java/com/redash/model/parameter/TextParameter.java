package com.redash.model.parameter;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A free-text parameter.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TextParameter extends QueryParameter {

    private String value;

    public TextParameter(String name, String title, String value) {
        super(name, title);
        this.value = value;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.TEXT;
    }
}
