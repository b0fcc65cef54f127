package org.flagenums.core;

import org.flagenums.bean.$;
import org.flagenums.bean.NEnum;

import java.util.List;

/**
 * Same as {@link FlagEnums} for callers holding an unconstrained {@code Class<?>}, e.g. generic or reflective code.
 * Every method first fails with {@link org.flagenums.exception.NotAnEnumerationException} when {@code type} is not
 * an enum implementing {@link NEnum}.
 */
public final class UnsafeFlagEnums {
    public static boolean isFlagEnum(Class<?> type) {
        return Enums.describe(type).isFlagEnum();
    }

    public static long getAllFlags(Class<?> type) {
        return Enums.describe(type).getAllFlags();
    }

    public static boolean isValidFlagCombination(Class<?> type, long value) {
        return engine(type).isValidFlagCombination(value);
    }

    public static List<? extends NEnum<?>> getFlags(Class<?> type, long value) {
        return engine(type).getFlags(value);
    }

    public static List<? extends EnumMember<?>> getFlagMembers(Class<?> type, long value) {
        return engine(type).getFlagMembers(value);
    }

    public static boolean hasAnyFlags(Class<?> type, long value) {
        return engine(type).hasAnyFlags(value);
    }

    public static boolean hasAnyFlags(Class<?> type, long value, long flagMask) {
        return engine(type).hasAnyFlags(value, flagMask);
    }

    public static boolean hasAllFlags(Class<?> type, long value) {
        return engine(type).hasAllFlags(value);
    }

    public static boolean hasAllFlags(Class<?> type, long value, long flagMask) {
        return engine(type).hasAllFlags(value, flagMask);
    }

    public static long toggleFlags(Class<?> type, long value) {
        return engine(type).toggleFlags(value);
    }

    public static long toggleFlags(Class<?> type, long value, long flagMask) {
        return engine(type).toggleFlags(value, flagMask);
    }

    public static long commonFlags(Class<?> type, long value, long flagMask) {
        return engine(type).commonFlags(value, flagMask);
    }

    public static long setFlags(Class<?> type, long... flags) {
        return engine(type).setFlags(flags);
    }

    public static long clearFlags(Class<?> type, long value, long flagMask) {
        return engine(type).clearFlags(value, flagMask);
    }

    public static String formatAsFlags(Class<?> type, long value) {
        return engine(type).formatAsFlags(value, null);
    }

    public static String formatAsFlags(Class<?> type, long value, String delimiter, MemberFormat... formats) {
        return engine(type).formatAsFlags(value, delimiter, formats);
    }

    public static long parse(Class<?> type, String text) {
        return engine(type).parse(text, false, null);
    }

    public static long parse(Class<?> type, String text, boolean ignoreCase, String delimiter, MemberFormat... formats) {
        return engine(type).parse(text, ignoreCase, delimiter, formats);
    }

    public static boolean tryParse(Class<?> type, String text, $<Long> result) {
        return engine(type).tryParse(text, false, null, result);
    }

    public static boolean tryParse(Class<?> type, String text, boolean ignoreCase, String delimiter, $<Long> result, MemberFormat... formats) {
        return engine(type).tryParse(text, ignoreCase, delimiter, result, formats);
    }

    public static long parseOrDefault(Class<?> type, String text, long defaultValue) {
        return engine(type).parseOrDefault(text, false, null, defaultValue);
    }

    public static long parseOrDefault(Class<?> type, String text, boolean ignoreCase, String delimiter, long defaultValue, MemberFormat... formats) {
        return engine(type).parseOrDefault(text, ignoreCase, delimiter, defaultValue, formats);
    }

    static FlagEngine<?> engine(Class<?> type) {
        return Enums.describe(type).flags();
    }

    private UnsafeFlagEnums() {
    }
}
