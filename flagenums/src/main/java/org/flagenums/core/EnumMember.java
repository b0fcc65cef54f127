package org.flagenums.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.flagenums.bean.NEnum;

/**
 * One declared constant of an enum with its name, value and optional description.
 */
@RequiredArgsConstructor
@Getter
@ToString(exclude = "constant")
public final class EnumMember<T extends Enum<T> & NEnum<T>> {
    final T constant;
    final String name;
    final long value;
    final String description;
    final UnderlyingType underlyingType;

    public String getDecimalValue() {
        return underlyingType.toDecimalString(value);
    }

    public String getHexadecimalValue() {
        return underlyingType.toHexString(value);
    }
}
