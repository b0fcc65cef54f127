package org.flagenums.core;

import org.apache.commons.lang3.StringUtils;

public enum EnumFormat implements MemberFormat {
    NAME {
        @Override
        public String format(EnumMember<?> member) {
            return member.getName();
        }
    },
    DECIMAL_VALUE {
        @Override
        public String format(EnumMember<?> member) {
            return member.getDecimalValue();
        }

        @Override
        public boolean matches(EnumMember<?> member, String token, boolean ignoreCase) {
            return member.getDecimalValue().equals(token);
        }
    },
    /**
     * Upper case digits padded to the storage width. Parsing ignores case, an optional {@code 0x} prefix and leading zeros.
     */
    HEXADECIMAL_VALUE {
        @Override
        public String format(EnumMember<?> member) {
            return member.getHexadecimalValue();
        }

        @Override
        public boolean matches(EnumMember<?> member, String token, boolean ignoreCase) {
            String digits = StringUtils.removeStartIgnoreCase(token, Constants.HEX_PREFIX);
            if (digits.isEmpty()) {
                return false;
            }
            return stripZeros(member.getHexadecimalValue()).equalsIgnoreCase(stripZeros(digits));
        }
    },
    /**
     * Text of the {@code @Metadata} annotation on the constant.
     */
    DESCRIPTION {
        @Override
        public String format(EnumMember<?> member) {
            return member.getDescription();
        }
    };

    static String stripZeros(String hex) {
        String s = StringUtils.stripStart(hex, "0");
        return s.isEmpty() ? "0" : s;
    }
}
