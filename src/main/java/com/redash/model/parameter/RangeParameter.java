package com.redash.model.parameter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Base for the three range kinds.
 * <p>
 * The value is held in its canonical form, a single {@code "<start>|<end>"} string. On the
 * wire it is usually a {@code {"start": ..., "end": ...}} object; the conversion is done by
 * {@link com.redash.codec.RangeBridge}, so the field is hidden from plain data binding.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract sealed class RangeParameter extends QueryParameter
        permits DateRangeParameter, DateTimeRangeParameter, DateTimeWithSecondsRangeParameter {

    @JsonIgnore
    private String value;

    protected RangeParameter(String name, String title, String value) {
        super(name, title);
        this.value = value;
    }
}
