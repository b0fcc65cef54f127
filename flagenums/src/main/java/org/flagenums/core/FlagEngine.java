package org.flagenums.core;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flagenums.bean.$;
import org.flagenums.bean.NEnum;
import org.flagenums.exception.BlankArgumentException;
import org.flagenums.exception.InvalidException;
import org.flagenums.exception.InvalidFlagCombinationException;
import org.flagenums.exception.UnresolvedFlagNameException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import static org.flagenums.bean.$.$;

/**
 * Flag operations over the members of one {@link EnumInfo}. Values are raw bit patterns of the enum's
 * {@link UnderlyingType}; a value is a valid combination when every set bit belongs to some declared member.
 * <p>
 * Decomposition walks members in declaration order, so a combined constant declared before its parts wins over them.
 * Partially overlapping constants, e.g. {@code A=0b011} and {@code B=0b110}, decompose differently depending on
 * which one is declared first. Bits the first pass leaves uncovered are then claimed by members lying inside
 * {@code value} even if they share bits already taken, so for {@code value=0b111} the result is {@code [A, B]} and the
 * members still OR back to {@code value}. Bits no member inside {@code value} covers are reported as a numeric remainder.
 */
@Slf4j
@RequiredArgsConstructor
public final class FlagEngine<T extends Enum<T> & NEnum<T>> {
    static final String VALUE = "value", FLAG_MASK = "flagMask", TEXT = "text", DELIMITER = "delimiter";

    @RequiredArgsConstructor
    static final class Decomposition<T extends Enum<T> & NEnum<T>> {
        final List<EnumMember<T>> members;
        //bits no declared member within the value covers
        final long remainder;
    }

    final EnumInfo<T> info;

    //region validity
    public boolean isValidFlagCombination(long value) {
        return info.underlyingType.isInRange(value) && (value & ~info.allFlags) == 0;
    }

    void requireValid(long value, String paramName) {
        if (!isValidFlagCombination(value)) {
            throw new InvalidFlagCombinationException(info.type, paramName, value);
        }
    }

    /**
     * @return declared constants whose values OR to {@code value}, null if {@code value} is not a valid combination
     */
    public List<T> getFlags(long value) {
        List<EnumMember<T>> members = getFlagMembers(value);
        if (members == null) {
            return null;
        }
        List<T> flags = new ArrayList<>(members.size());
        for (EnumMember<T> member : members) {
            flags.add(member.constant);
        }
        return flags;
    }

    public List<EnumMember<T>> getFlagMembers(long value) {
        if (!isValidFlagCombination(value)) {
            return null;
        }
        return decompose(value).members;
    }

    Decomposition<T> decompose(long value) {
        if (value == 0) {
            List<EnumMember<T>> zero = info.zeroMember != null ? Collections.singletonList(info.zeroMember) : Collections.emptyList();
            return new Decomposition<>(zero, 0);
        }

        List<EnumMember<T>> result = new ArrayList<>();
        long remaining = value;
        for (EnumMember<T> member : info.members) {
            long v = member.value;
            if (v != 0 && (remaining & v) == v) {
                result.add(member);
                if ((remaining &= ~v) == 0) {
                    return new Decomposition<>(result, 0);
                }
            }
        }
        //overlapping constants left bits behind, take members inside value that still cover them
        for (EnumMember<T> member : info.members) {
            long v = member.value;
            if (v != 0 && (value & v) == v && (remaining & v) != 0) {
                result.add(member);
                if ((remaining &= ~v) == 0) {
                    break;
                }
            }
        }
        return new Decomposition<>(result, remaining);
    }

    public boolean hasAnyFlags(long value) {
        requireValid(value, VALUE);
        return value != 0;
    }

    public boolean hasAnyFlags(long value, long flagMask) {
        requireValid(value, VALUE);
        requireValid(flagMask, FLAG_MASK);
        return (value & flagMask) != 0;
    }

    public boolean hasAllFlags(long value) {
        requireValid(value, VALUE);
        return value == info.allFlags;
    }

    public boolean hasAllFlags(long value, long flagMask) {
        requireValid(value, VALUE);
        requireValid(flagMask, FLAG_MASK);
        return (value & flagMask) == flagMask;
    }
    //endregion

    //region bit algebra
    public long toggleFlags(long value) {
        requireValid(value, VALUE);
        return value ^ info.allFlags;
    }

    public long toggleFlags(long value, long flagMask) {
        requireValid(value, VALUE);
        requireValid(flagMask, FLAG_MASK);
        return value ^ flagMask;
    }

    public long commonFlags(long value, long flagMask) {
        requireValid(value, VALUE);
        requireValid(flagMask, FLAG_MASK);
        return value & flagMask;
    }

    public long setFlags(@NonNull long... flags) {
        long result = 0;
        for (int i = 0; i < flags.length; i++) {
            requireValid(flags[i], "flags[" + i + "]");
            result |= flags[i];
        }
        return result;
    }

    public long clearFlags(long value, long flagMask) {
        requireValid(value, VALUE);
        requireValid(flagMask, FLAG_MASK);
        return value & ~flagMask;
    }
    //endregion

    //region format
    /**
     * @param delimiter joins the flags as given, null for the configured default
     * @param formats   tried in order per flag, none for the configured default
     * @return delimited flags, {@code "0"} for an empty decomposition, null if {@code value} is not a valid combination
     */
    public String formatAsFlags(long value, String delimiter, MemberFormat... formats) {
        if (delimiter == null) {
            delimiter = FlagEnumConfig.INSTANCE.getDelimiter();
        } else if (delimiter.isEmpty()) {
            throw new BlankArgumentException(DELIMITER);
        }
        if (!isValidFlagCombination(value)) {
            return null;
        }

        Decomposition<T> d = decompose(value);
        if (d.members.isEmpty() && d.remainder == 0) {
            return Constants.ZERO_TEXT;
        }
        MemberFormat[] fs = resolveFormats(formats);
        StringJoiner joiner = new StringJoiner(delimiter);
        for (EnumMember<T> member : d.members) {
            joiner.add(format(member, fs));
        }
        if (d.remainder != 0) {
            joiner.add(info.underlyingType.toDecimalString(d.remainder));
        }
        return joiner.toString();
    }

    String format(EnumMember<T> member, MemberFormat[] formats) {
        for (MemberFormat format : formats) {
            String text = format.format(member);
            if (text != null) {
                return text;
            }
        }
        return member.name;
    }

    MemberFormat[] resolveFormats(MemberFormat[] formats) {
        return formats == null || formats.length == 0 ? FlagEnumConfig.INSTANCE.formatArray() : formats;
    }
    //endregion

    //region parse
    /**
     * ORs the values of all delimited tokens. The result is not checked against the declared flags, so numeric
     * tokens outside them are kept.
     *
     * @param delimiter trimmed before splitting, whitespace runs split when it trims to empty, null for the configured default
     * @throws NullPointerException         {@code text} is null
     * @throws BlankArgumentException       {@code text} is empty or whitespace
     * @throws UnresolvedFlagNameException  a token matches no format and is not a numeric literal
     * @throws org.flagenums.exception.FlagOverflowException a numeric literal is out of range of the underlying type
     */
    public long parse(@NonNull String text, boolean ignoreCase, String delimiter, MemberFormat... formats) {
        if (Strings.isBlank(text)) {
            throw new BlankArgumentException(TEXT);
        }
        return parseCore(text, ignoreCase, delimiter, formats);
    }

    /**
     * Same as {@link #parse} but reports failure by returning false, leaving 0 in {@code result}.
     */
    public boolean tryParse(String text, boolean ignoreCase, String delimiter, @NonNull $<Long> result, MemberFormat... formats) {
        result.v = 0L;
        if (Strings.isBlank(text)) {
            return false;
        }
        try {
            result.v = parseCore(text, ignoreCase, delimiter, formats);
            return true;
        } catch (InvalidException e) {
            log.debug("tryParse {} '{}' fail, {}", info.type.getSimpleName(), text, e.getMessage());
            return false;
        }
    }

    public long parseOrDefault(String text, boolean ignoreCase, String delimiter, long defaultValue, MemberFormat... formats) {
        $<Long> result = $();
        return tryParse(text, ignoreCase, delimiter, result, formats) ? result.v : defaultValue;
    }

    long parseCore(String text, boolean ignoreCase, String delimiter, MemberFormat[] formats) {
        MemberFormat[] fs = resolveFormats(formats);
        List<String> tokens = Strings.splitTokens(text, delimiter != null ? delimiter : FlagEnumConfig.INSTANCE.getDelimiter());
        if (tokens.isEmpty()) {
            throw new UnresolvedFlagNameException(info.type, text);
        }
        long result = 0;
        for (String token : tokens) {
            result |= resolve(token, ignoreCase, fs);
        }
        return result;
    }

    long resolve(String token, boolean ignoreCase, MemberFormat[] formats) {
        for (MemberFormat format : formats) {
            if (format == EnumFormat.NAME && !ignoreCase) {
                EnumMember<T> member = info.getMember(token);
                if (member != null) {
                    return member.value;
                }
                continue;
            }
            for (EnumMember<T> member : info.members) {
                if (format.matches(member, token, ignoreCase)) {
                    return member.value;
                }
            }
        }
        Long literal = info.underlyingType.parseLiteral(token);
        if (literal == null) {
            throw new UnresolvedFlagNameException(info.type, token);
        }
        return literal;
    }
    //endregion
}
