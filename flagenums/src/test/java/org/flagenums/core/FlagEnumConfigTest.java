package org.flagenums.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FlagEnumConfigTest {
    static YamlConfiguration flagsConf(Map<String, Object> flags) {
        Map<String, Object> app = new LinkedHashMap<>();
        app.put("flags", flags);
        return new YamlConfiguration(Collections.singletonMap("app", app));
    }

    @Test
    public void defaultsFromYaml() {
        assertEquals(", ", YamlConfiguration.RX_CONF.read(FlagEnumConfig.ConfigNames.DELIMITER, null));
        assertEquals(Arrays.asList("NAME", "DECIMAL_VALUE"), YamlConfiguration.RX_CONF.read(FlagEnumConfig.ConfigNames.FORMATS, null));
        assertEquals("missing", YamlConfiguration.RX_CONF.read("app.flags.missing", "missing"));
        assertEquals("missing", YamlConfiguration.RX_CONF.read("app.flags.delimiter.deeper", "missing"));

        FlagEnumConfig conf = FlagEnumConfig.INSTANCE;
        assertEquals(", ", conf.getDelimiter());
        assertEquals(Arrays.asList(EnumFormat.NAME, EnumFormat.DECIMAL_VALUE), conf.getFormats());
        assertFalse(conf.isIgnoreCase());
        assertArrayEquals(new MemberFormat[]{EnumFormat.NAME, EnumFormat.DECIMAL_VALUE}, conf.getFormatArray());
    }

    @Test
    public void refreshFrom() {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("delimiter", "|");
        flags.put("formats", "description, name");
        flags.put("ignoreCase", true);

        FlagEnumConfig conf = new FlagEnumConfig();
        assertArrayEquals(new MemberFormat[]{EnumFormat.NAME, EnumFormat.DECIMAL_VALUE}, conf.getFormatArray());
        conf.refreshFrom(flagsConf(flags));
        assertEquals("|", conf.getDelimiter());
        assertEquals(Arrays.asList(EnumFormat.DESCRIPTION, EnumFormat.NAME), conf.getFormats());
        assertArrayEquals(new MemberFormat[]{EnumFormat.DESCRIPTION, EnumFormat.NAME}, conf.getFormatArray());
        assertTrue(conf.isIgnoreCase());

        flags.put("delimiter", "");
        flags.put("formats", Collections.emptyList());
        conf.refreshFrom(flagsConf(flags));
        assertEquals(Constants.DEFAULT_DELIMITER, conf.getDelimiter());
        assertEquals(FlagEnumConfig.DEFAULT_FORMATS, conf.getFormats());
    }

    @Test
    public void unknownFormat() {
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("formats", Collections.singletonList("ORDINAL"));
        FlagEnumConfig conf = new FlagEnumConfig();
        assertThrows(IllegalArgumentException.class, () -> conf.refreshFrom(flagsConf(flags)));
    }

    @Test
    public void systemPropertyOverride() {
        //initialize the shared instance before the properties below exist
        assertNotNull(FlagEnumConfig.INSTANCE);
        System.setProperty(FlagEnumConfig.ConfigNames.DELIMITER, ";");
        System.setProperty(FlagEnumConfig.ConfigNames.FORMATS, "HEXADECIMAL_VALUE");
        System.setProperty(FlagEnumConfig.ConfigNames.IGNORE_CASE, "true");
        try {
            FlagEnumConfig conf = new FlagEnumConfig();
            conf.refreshFrom(YamlConfiguration.RX_CONF);
            conf.refreshFromSystemProperty();
            assertEquals(";", conf.getDelimiter());
            assertEquals(Collections.singletonList(EnumFormat.HEXADECIMAL_VALUE), conf.getFormats());
            assertTrue(conf.isIgnoreCase());
        } finally {
            System.clearProperty(FlagEnumConfig.ConfigNames.DELIMITER);
            System.clearProperty(FlagEnumConfig.ConfigNames.FORMATS);
            System.clearProperty(FlagEnumConfig.ConfigNames.IGNORE_CASE);
        }
    }

    @Test
    public void loadFallsBackOnBadFormats() {
        assertNotNull(FlagEnumConfig.INSTANCE);
        Map<String, Object> flags = new LinkedHashMap<>();
        flags.put("delimiter", "|");
        flags.put("formats", Collections.singletonList("ORDINAL"));
        System.setProperty(FlagEnumConfig.ConfigNames.FORMATS, "ORDINAL");
        try {
            FlagEnumConfig conf = FlagEnumConfig.load(flagsConf(flags));
            assertEquals("|", conf.getDelimiter());
            assertEquals(FlagEnumConfig.DEFAULT_FORMATS, conf.getFormats());
            assertArrayEquals(new MemberFormat[]{EnumFormat.NAME, EnumFormat.DECIMAL_VALUE}, conf.getFormatArray());
        } finally {
            System.clearProperty(FlagEnumConfig.ConfigNames.FORMATS);
        }
    }

    @Test
    public void formatsNotWritableFromOutside() {
        FlagEnumConfig conf = new FlagEnumConfig();
        assertThrows(UnsupportedOperationException.class, () -> conf.getFormats().add(EnumFormat.DESCRIPTION));
        conf.getFormatArray()[0] = EnumFormat.DESCRIPTION;
        assertEquals(EnumFormat.NAME, conf.getFormatArray()[0]);
        assertEquals(EnumFormat.NAME, conf.formatArray()[0]);
    }
}
