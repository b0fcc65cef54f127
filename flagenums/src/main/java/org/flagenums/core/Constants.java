package org.flagenums.core;

public interface Constants {
    String NON_UNCHECKED = "unchecked";
    String NON_RAW_TYPES = "unchecked,rawtypes";

    String[] DEFAULT_CONFIG_FILES = {"flagenums.yml"};
    String CONFIG_KEY_SPLITS = ".";

    String DEFAULT_DELIMITER = ", ";
    String ZERO_TEXT = "0";
    String HEX_PREFIX = "0x";
}
