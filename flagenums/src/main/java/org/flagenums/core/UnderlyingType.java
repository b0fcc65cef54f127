package org.flagenums.core;

import lombok.Getter;
import org.flagenums.exception.FlagOverflowException;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Integer storage of an enum. Values travel as {@code long} bit patterns: signed types sign-extended,
 * unsigned types zero-extended, {@link #ULONG} using all 64 bits as unsigned.
 */
public enum UnderlyingType {
    BYTE(8, true),
    UBYTE(8, false),
    SHORT(16, true),
    USHORT(16, false),
    INT(32, true),
    UINT(32, false),
    LONG(64, true),
    ULONG(64, false);

    static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");

    @Getter
    final int bits;
    @Getter
    final boolean signed;
    final BigInteger min, max;

    UnderlyingType(int bits, boolean signed) {
        this.bits = bits;
        this.signed = signed;
        if (signed) {
            min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        } else {
            min = BigInteger.ZERO;
            max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        }
    }

    public String getMinText() {
        return min.toString();
    }

    public String getMaxText() {
        return max.toString();
    }

    /**
     * @param raw bit pattern
     * @return whether {@code raw} is the canonical representation of a value of this type
     */
    public boolean isInRange(long raw) {
        if (bits == 64) {
            return true;
        }
        return min.longValue() <= raw && raw <= max.longValue();
    }

    public String toDecimalString(long raw) {
        return this == ULONG ? Long.toUnsignedString(raw) : Long.toString(raw);
    }

    public String toHexString(long raw) {
        long masked = bits == 64 ? raw : raw & ((1L << bits) - 1);
        return Strings.leftPad(Long.toHexString(masked).toUpperCase(), bits / 4, '0');
    }

    /**
     * Parses a decimal integer literal with optional sign.
     *
     * @return the bit pattern, or null if {@code literal} is not an integer literal
     * @throws FlagOverflowException the literal is outside the range of this type
     */
    public Long parseLiteral(String literal) {
        if (literal == null || !INTEGER_LITERAL.matcher(literal).matches()) {
            return null;
        }
        BigInteger n = new BigInteger(literal);
        if (n.compareTo(min) < 0 || n.compareTo(max) > 0) {
            throw new FlagOverflowException(literal, this);
        }
        return n.longValue();
    }
}
