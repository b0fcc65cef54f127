package org.flagenums.core;

import io.netty.util.internal.SystemPropertyUtil;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Defaults applied when a call leaves delimiter or formats unspecified.
 * Read from {@code flagenums.yml} under {@code app.flags}, then from system properties of the same names.
 */
@Slf4j
@Getter
@Setter
@ToString
public final class FlagEnumConfig {
    public interface ConfigNames {
        String DELIMITER = "app.flags.delimiter";
        String FORMATS = "app.flags.formats";
        String IGNORE_CASE = "app.flags.ignoreCase";
    }

    static final List<EnumFormat> DEFAULT_FORMATS = Arrays.asList(EnumFormat.NAME, EnumFormat.DECIMAL_VALUE);
    public static final FlagEnumConfig INSTANCE;

    static {
        INSTANCE = load(YamlConfiguration.RX_CONF);
    }

    /**
     * Settings that fail to load are logged and left at their defaults.
     */
    static FlagEnumConfig load(YamlConfiguration conf) {
        FlagEnumConfig t = new FlagEnumConfig();
        try {
            t.refreshFrom(conf);
        } catch (Throwable e) {
            log.error("FlagEnumConfig load yaml error", e);
        }
        try {
            t.refreshFromSystemProperty();
        } catch (Throwable e) {
            log.error("FlagEnumConfig load system property error", e);
        }
        t.afterSet();
        return t;
    }

    String delimiter = Constants.DEFAULT_DELIMITER;
    //parse also tries a plain numeric literal after these
    final List<EnumFormat> formats = new CopyOnWriteArrayList<>(DEFAULT_FORMATS);
    boolean ignoreCase;
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    private volatile MemberFormat[] formatArray;

    FlagEnumConfig() {
    }

    public List<EnumFormat> getFormats() {
        return Collections.unmodifiableList(formats);
    }

    /**
     * @return a copy, callers may keep or change it
     */
    public MemberFormat[] getFormatArray() {
        return formatArray().clone();
    }

    MemberFormat[] formatArray() {
        MemberFormat[] a = formatArray;
        if (a == null) {
            formatArray = a = formats.toArray(new MemberFormat[0]);
        }
        return a;
    }

    public void refreshFrom(@NonNull YamlConfiguration conf) {
        Object v = conf.read(ConfigNames.DELIMITER, null);
        if (v != null) {
            delimiter = v.toString();
        }
        v = conf.read(ConfigNames.FORMATS, null);
        if (v != null) {
            resetFormats(v instanceof Collection ? (Collection<?>) v : Arrays.asList(Strings.split(v.toString(), ",")));
        }
        v = conf.read(ConfigNames.IGNORE_CASE, null);
        if (v != null) {
            ignoreCase = Boolean.parseBoolean(v.toString());
        }
        afterSet();
    }

    public void refreshFromSystemProperty() {
        delimiter = SystemPropertyUtil.get(ConfigNames.DELIMITER, delimiter);
        ignoreCase = SystemPropertyUtil.getBoolean(ConfigNames.IGNORE_CASE, ignoreCase);
        String v = SystemPropertyUtil.get(ConfigNames.FORMATS);
        if (v != null) {
            resetFormats(Arrays.asList(Strings.split(v, ",")));
        }
        afterSet();
    }

    void resetFormats(Collection<?> names) {
        List<EnumFormat> list = new ArrayList<>(names.size());
        for (Object name : names) {
            String n = Strings.trimToNull(String.valueOf(name));
            if (n != null) {
                list.add(EnumFormat.valueOf(n.toUpperCase()));
            }
        }
        formats.clear();
        formats.addAll(list);
    }

    void afterSet() {
        if (Strings.isEmpty(delimiter)) {
            delimiter = Constants.DEFAULT_DELIMITER;
        }
        if (formats.isEmpty()) {
            formats.addAll(DEFAULT_FORMATS);
        }
        formatArray = null;
        log.debug("FlagEnumConfig {}", this);
    }
}
