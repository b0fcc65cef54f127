package org.flagenums.bean;

import lombok.Getter;
import lombok.NonNull;
import org.flagenums.core.EnumFormat;
import org.flagenums.core.Enums;
import org.flagenums.core.FlagEngine;
import org.flagenums.core.FlagEnumConfig;

import java.util.EnumSet;
import java.util.List;

import static org.flagenums.core.Constants.NON_UNCHECKED;

/**
 * Combined value of one {@link NEnum} type. Mutable, so equality is identity; compare {@link #getValue()} instead.
 */
public final class FlagsEnum<T extends Enum<T> & NEnum<T>> implements NEnum<T> {
    private static final long serialVersionUID = 2650923180459277341L;

    public static <T extends Enum<T> & NEnum<T>> FlagsEnum<T> valueOf(@NonNull Class<T> type, long flags) {
        return new FlagsEnum<>(type, flags);
    }

    public static <T extends Enum<T> & NEnum<T>> FlagsEnum<T> valueOf(@NonNull Class<T> type, @NonNull EnumSet<T> enumSet) {
        long flags = 0;
        for (T t : enumSet) {
            flags |= t.getValue();
        }
        return valueOf(type, flags);
    }

    /**
     * Parses {@code names} with the configured delimiter and case sensitivity.
     */
    public static <T extends Enum<T> & NEnum<T>> FlagsEnum<T> valueOf(@NonNull Class<T> type, @NonNull String names) {
        FlagEnumConfig conf = FlagEnumConfig.INSTANCE;
        return valueOf(type, Enums.info(type).flags().parse(names, conf.isIgnoreCase(), conf.getDelimiter()));
    }

    @Getter
    private final Class<T> type;
    private long flags;

    @SuppressWarnings(NON_UNCHECKED)
    FlagsEnum(@NonNull NEnum<T> nEnum) {
        if (nEnum instanceof FlagsEnum) {
            type = ((FlagsEnum<T>) nEnum).type;
        } else {
            type = ((T) nEnum).getDeclaringClass();
        }
        flags = nEnum.getValue();
    }

    private FlagsEnum(Class<T> type, long flags) {
        this.type = type;
        this.flags = flags;
    }

    FlagEngine<T> engine() {
        return Enums.info(type).flags();
    }

    /**
     * @return delimited names of the flags, the decimal value if it is not a valid combination
     */
    public String name() {
        String s = engine().formatAsFlags(flags, null);
        return s != null ? s : Enums.info(type).getUnderlyingType().toDecimalString(flags);
    }

    @Override
    public long getValue() {
        return flags;
    }

    @Override
    public String description() {
        String s = engine().formatAsFlags(flags, null, EnumFormat.DESCRIPTION, EnumFormat.NAME);
        return s != null ? s : name();
    }

    public boolean isValid() {
        return engine().isValidFlagCombination(flags);
    }

    public FlagsEnum<T> add(@NonNull FlagsEnum<T> fEnum) {
        flags = engine().setFlags(flags, fEnum.flags);
        return this;
    }

    public FlagsEnum<T> remove(@NonNull FlagsEnum<T> fEnum) {
        flags = engine().clearFlags(flags, fEnum.flags);
        return this;
    }

    public boolean has(@NonNull FlagsEnum<T> fEnum) {
        return engine().hasAllFlags(flags, fEnum.flags);
    }

    @SuppressWarnings(NON_UNCHECKED)
    public FlagsEnum<T> add(T... nEnum) {
        flags = engine().setFlags(flags, mask(nEnum));
        return this;
    }

    @SuppressWarnings(NON_UNCHECKED)
    public FlagsEnum<T> remove(T... nEnum) {
        flags = engine().clearFlags(flags, mask(nEnum));
        return this;
    }

    @SuppressWarnings(NON_UNCHECKED)
    public boolean has(T... nEnum) {
        return engine().hasAllFlags(flags, mask(nEnum));
    }

    public FlagsEnum<T> toggle() {
        flags = engine().toggleFlags(flags);
        return this;
    }

    /**
     * @return decomposed flags, empty if the value is not a valid combination
     */
    public EnumSet<T> toSet() {
        EnumSet<T> set = EnumSet.noneOf(type);
        List<T> list = engine().getFlags(flags);
        if (list != null) {
            set.addAll(list);
        }
        return set;
    }

    @Override
    public String toString() {
        return name();
    }

    @SuppressWarnings(NON_UNCHECKED)
    static <T extends Enum<T> & NEnum<T>> long mask(T... nEnum) {
        long val = 0;
        if (nEnum != null) {
            for (T t : nEnum) {
                val |= t.getValue();
            }
        }
        return val;
    }
}
