package org.flagenums.core;

import java.util.ArrayList;
import java.util.List;

public class Strings extends org.apache.commons.lang3.StringUtils {
    /**
     * Splits {@code text} on the trimmed {@code delimiter}, on whitespace runs when the delimiter trims to empty.
     * Tokens are trimmed and empty tokens dropped.
     */
    public static List<String> splitTokens(String text, String delimiter) {
        String sep = trimToEmpty(delimiter);
        String[] parts = sep.isEmpty() ? split(text) : splitByWholeSeparatorPreserveAllTokens(text, sep);
        List<String> tokens = new ArrayList<>(parts.length);
        for (String part : parts) {
            String token = trim(part);
            if (!isEmpty(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
