package org.flagenums.bean;

import lombok.NonNull;
import org.flagenums.core.Enums;

import java.io.Serializable;

import static org.flagenums.core.Constants.NON_UNCHECKED;

/**
 * Enum with an explicit integer value. Flag enums combine these values bitwise.
 */
public interface NEnum<T extends Enum<T> & NEnum<T>> extends Serializable {
    /**
     * @return first declared constant of {@code type} with {@code value}, null if none
     */
    static <T extends Enum<T> & NEnum<T>> T valueOf(@NonNull Class<T> type, long value) {
        for (T nEnum : type.getEnumConstants()) {
            if (nEnum.getValue() == value) {
                return nEnum;
            }
        }
        return null;
    }

    long getValue();

    default FlagsEnum<T> flags() {
        return new FlagsEnum<>(this);
    }

    @SuppressWarnings(NON_UNCHECKED)
    default FlagsEnum<T> flags(T... nEnum) {
        FlagsEnum<T> flagsEnum = flags();
        flagsEnum.add(nEnum);
        return flagsEnum;
    }

    @SuppressWarnings(NON_UNCHECKED)
    default String description() {
        T self = (T) this;
        return Enums.info(self.getDeclaringClass()).getMember(self).getDescription();
    }
}
