package org.flagenums.core;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.flagenums.bean.NEnum;
import org.flagenums.core.cache.MemoryCache;
import org.flagenums.exception.NotAnEnumerationException;
import org.flagenums.util.Lazy;

import static org.flagenums.core.Constants.NON_RAW_TYPES;
import static org.flagenums.core.Constants.NON_UNCHECKED;

/**
 * Builds and caches one {@link EnumInfo} per enum type for the life of the process.
 */
@Slf4j
public final class Enums {
    static final Lazy<Cache<Class<?>, EnumInfo<?>>> infoCache = new Lazy<>(MemoryCache::new);

    @SuppressWarnings(NON_UNCHECKED)
    public static <T extends Enum<T> & NEnum<T>> EnumInfo<T> info(@NonNull Class<T> type) {
        return (EnumInfo<T>) describe(type);
    }

    /**
     * @throws NotAnEnumerationException {@code type} is not an enum implementing {@link NEnum}
     */
    public static EnumInfo<?> describe(Class<?> type) {
        verifyTypeIsEnum(type);
        return infoCache.getValue().get(type, Enums::build);
    }

    public static boolean isEnum(Class<?> type) {
        return type != null && type.isEnum() && NEnum.class.isAssignableFrom(type);
    }

    public static void verifyTypeIsEnum(Class<?> type) {
        if (!isEnum(type)) {
            throw new NotAnEnumerationException(type);
        }
    }

    @SuppressWarnings(NON_RAW_TYPES)
    static EnumInfo<?> build(Class<?> type) {
        EnumInfo<?> info = new EnumInfo(type);
        log.debug("Describe {} storage={} flagEnum={} members={} allFlags={}", type.getName(), info.getUnderlyingType(),
                info.isFlagEnum(), info.getMembers().size(), info.getUnderlyingType().toHexString(info.getAllFlags()));
        return info;
    }

    private Enums() {
    }
}
