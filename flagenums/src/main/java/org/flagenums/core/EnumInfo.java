package org.flagenums.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.SneakyThrows;
import org.flagenums.annotation.EnumStorage;
import org.flagenums.annotation.Flags;
import org.flagenums.bean.NEnum;
import org.flagenums.exception.InvalidException;

import java.util.List;

import static org.flagenums.core.Extends.metadata;

/**
 * Immutable per type summary of an {@link NEnum}: storage, declared members in order and the union of their bits.
 * Instances are built once per type by {@link Enums#describe(Class)}.
 */
@Getter
public final class EnumInfo<T extends Enum<T> & NEnum<T>> {
    final Class<T> type;
    final UnderlyingType underlyingType;
    final boolean flagEnum;
    final List<EnumMember<T>> members;
    final long allFlags;
    /**
     * First declared member with value 0, null if none.
     */
    final EnumMember<T> zeroMember;
    @Getter(AccessLevel.NONE)
    final ImmutableMap<String, EnumMember<T>> nameMap;
    @Getter(AccessLevel.NONE)
    final FlagEngine<T> flagEngine;

    @SneakyThrows
    EnumInfo(@NonNull Class<T> type) {
        this.type = type;
        EnumStorage storage = type.getAnnotation(EnumStorage.class);
        underlyingType = storage != null ? storage.value() : UnderlyingType.INT;
        flagEnum = type.isAnnotationPresent(Flags.class);

        ImmutableList.Builder<EnumMember<T>> list = ImmutableList.builder();
        ImmutableMap.Builder<String, EnumMember<T>> map = ImmutableMap.builder();
        long all = 0;
        EnumMember<T> zero = null;
        for (T constant : type.getEnumConstants()) {
            long value = constant.getValue();
            if (!underlyingType.isInRange(value)) {
                throw new InvalidException("Member {}.{}={} is out of range of {}", type.getSimpleName(), constant.name(), value, underlyingType);
            }
            EnumMember<T> member = new EnumMember<>(constant, constant.name(), value,
                    metadata(type.getField(constant.name())), underlyingType);
            list.add(member);
            map.put(member.getName(), member);
            all |= value;
            if (value == 0 && zero == null) {
                zero = member;
            }
        }
        members = list.build();
        nameMap = map.build();
        allFlags = all;
        zeroMember = zero;
        flagEngine = new FlagEngine<>(this);
    }

    public EnumMember<T> getMember(@NonNull T constant) {
        return members.get(constant.ordinal());
    }

    /**
     * @return member with exactly {@code name}, null if none
     */
    public EnumMember<T> getMember(String name) {
        return name == null ? null : nameMap.get(name);
    }

    public FlagEngine<T> flags() {
        return flagEngine;
    }
}
