package org.flagenums.core;

/**
 * Renders one enum member as text. Parsing accepts a token when it equals the rendered text.
 * Custom formats are plain lambdas, e.g. {@code m -> m.getName().toLowerCase()}.
 */
@FunctionalInterface
public interface MemberFormat {
    /**
     * @return text of {@code member}, null if this format has no representation for it
     */
    String format(EnumMember<?> member);

    default boolean matches(EnumMember<?> member, String token, boolean ignoreCase) {
        String text = format(member);
        if (text == null) {
            return false;
        }
        return ignoreCase ? text.equalsIgnoreCase(token) : text.equals(token);
    }
}
