package com.redash.model.parameter;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class NumberParameter extends QueryParameter {

    private double value;

    public NumberParameter(String name, String title, double value) {
        super(name, title);
        this.value = value;
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.NUMBER;
    }
}
