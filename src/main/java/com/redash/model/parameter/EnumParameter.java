package com.redash.model.parameter;

import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A dropdown whose choices are listed inline.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class EnumParameter extends SelectionParameter {

    /**
     * The available choices exactly as the service stores them: one per line.
     */
    private String enumOptions;

    public EnumParameter(String name, String title, List<String> values, String enumOptions,
                         MultiValuesOptions multiValuesOptions) {
        super(name, title, values, multiValuesOptions);
        this.enumOptions = enumOptions;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.ENUM;
    }
}
