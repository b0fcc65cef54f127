package org.flagenums.core;

import lombok.NonNull;
import org.flagenums.bean.$;
import org.flagenums.bean.NEnum;

import java.util.List;

/**
 * Flag operations over {@link NEnum} types. Values are raw bit patterns of the enum's {@link UnderlyingType}.
 * Operations taking a combination reject values with bits outside {@link #getAllFlags(Class)} with
 * {@link org.flagenums.exception.InvalidFlagCombinationException}.
 *
 * @see UnsafeFlagEnums
 */
public final class FlagEnums {
    //region properties
    public static <T extends Enum<T> & NEnum<T>> boolean isFlagEnum(@NonNull Class<T> type) {
        return Enums.info(type).isFlagEnum();
    }

    public static <T extends Enum<T> & NEnum<T>> long getAllFlags(@NonNull Class<T> type) {
        return Enums.info(type).getAllFlags();
    }
    //endregion

    //region main methods
    public static <T extends Enum<T> & NEnum<T>> boolean isValidFlagCombination(@NonNull Class<T> type, long value) {
        return engine(type).isValidFlagCombination(value);
    }

    /**
     * @return flags composing {@code value} in declaration order, null if {@code value} is not a valid combination
     */
    public static <T extends Enum<T> & NEnum<T>> List<T> getFlags(@NonNull Class<T> type, long value) {
        return engine(type).getFlags(value);
    }

    public static <T extends Enum<T> & NEnum<T>> List<EnumMember<T>> getFlagMembers(@NonNull Class<T> type, long value) {
        return engine(type).getFlagMembers(value);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean hasAnyFlags(@NonNull Class<T> type, long value) {
        return engine(type).hasAnyFlags(value);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean hasAnyFlags(@NonNull Class<T> type, long value, long flagMask) {
        return engine(type).hasAnyFlags(value, flagMask);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean hasAllFlags(@NonNull Class<T> type, long value) {
        return engine(type).hasAllFlags(value);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean hasAllFlags(@NonNull Class<T> type, long value, long flagMask) {
        return engine(type).hasAllFlags(value, flagMask);
    }

    public static <T extends Enum<T> & NEnum<T>> long toggleFlags(@NonNull Class<T> type, long value) {
        return engine(type).toggleFlags(value);
    }

    public static <T extends Enum<T> & NEnum<T>> long toggleFlags(@NonNull Class<T> type, long value, long flagMask) {
        return engine(type).toggleFlags(value, flagMask);
    }

    public static <T extends Enum<T> & NEnum<T>> long commonFlags(@NonNull Class<T> type, long value, long flagMask) {
        return engine(type).commonFlags(value, flagMask);
    }

    public static <T extends Enum<T> & NEnum<T>> long setFlags(@NonNull Class<T> type, long... flags) {
        return engine(type).setFlags(flags);
    }

    public static <T extends Enum<T> & NEnum<T>> long clearFlags(@NonNull Class<T> type, long value, long flagMask) {
        return engine(type).clearFlags(value, flagMask);
    }

    public static <T extends Enum<T> & NEnum<T>> String formatAsFlags(@NonNull Class<T> type, long value) {
        return engine(type).formatAsFlags(value, null);
    }

    public static <T extends Enum<T> & NEnum<T>> String formatAsFlags(@NonNull Class<T> type, long value, String delimiter, MemberFormat... formats) {
        return engine(type).formatAsFlags(value, delimiter, formats);
    }
    //endregion

    //region parsing
    public static <T extends Enum<T> & NEnum<T>> long parse(@NonNull Class<T> type, String text) {
        return engine(type).parse(text, false, null);
    }

    public static <T extends Enum<T> & NEnum<T>> long parse(@NonNull Class<T> type, String text, boolean ignoreCase, String delimiter, MemberFormat... formats) {
        return engine(type).parse(text, ignoreCase, delimiter, formats);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean tryParse(@NonNull Class<T> type, String text, $<Long> result) {
        return engine(type).tryParse(text, false, null, result);
    }

    public static <T extends Enum<T> & NEnum<T>> boolean tryParse(@NonNull Class<T> type, String text, boolean ignoreCase, String delimiter, $<Long> result, MemberFormat... formats) {
        return engine(type).tryParse(text, ignoreCase, delimiter, result, formats);
    }

    public static <T extends Enum<T> & NEnum<T>> long parseOrDefault(@NonNull Class<T> type, String text, long defaultValue) {
        return engine(type).parseOrDefault(text, false, null, defaultValue);
    }

    public static <T extends Enum<T> & NEnum<T>> long parseOrDefault(@NonNull Class<T> type, String text, boolean ignoreCase, String delimiter, long defaultValue, MemberFormat... formats) {
        return engine(type).parseOrDefault(text, ignoreCase, delimiter, defaultValue, formats);
    }
    //endregion

    static <T extends Enum<T> & NEnum<T>> FlagEngine<T> engine(Class<T> type) {
        return Enums.info(type).flags();
    }

    private FlagEnums() {
    }
}
