// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.treedispatch.engine;

import java.math.BigInteger;

/**
 * The arithmetic used by the standard evaluation handlers. Integers
 * are represented by {@code Long} while they fit, and by
 * {@code BigInteger} once a result overflows, so integer arithmetic
 * does not wrap. If either operand is floating-point, the operation is
 * carried out in {@code double}, with the rounding and overflow (to
 * infinity) that implies.
 * <p>
 * {@code Byte}, {@code Short} and {@code Integer} operands are accepted
 * as integers and {@code Float} as floating-point, so that handlers for
 * new kinds of node may return them. Any other kind of {@code Number}
 * is rejected.
 */
public final class Arithmetic {

    private Arithmetic() {} // no instances

    private static final long BIT63 = 0x8000_0000_0000_0000L;
    private static final BigInteger BIG_2_64 =
            BigInteger.ONE.shiftLeft(64);

    /**
     * Return {@code v + w}.
     *
     * @param v left operand
     * @param w right operand
     * @return the sum
     * @throws IllegalArgumentException if an operand is not a supported
     *     kind of number
     */
    public static Number add(Number v, Number w)
            throws IllegalArgumentException {
        if (isFloat(v) || isFloat(w)) {
            return toDouble(v) + toDouble(w);
        } else if (v instanceof BigInteger || w instanceof BigInteger) {
            return toBig(v).add(toBig(w));
        } else {
            return longAdd(toLong(v), toLong(w));
        }
    }

    /**
     * Return {@code v - w}.
     *
     * @param v left operand
     * @param w right operand
     * @return the difference
     * @throws IllegalArgumentException if an operand is not a supported
     *     kind of number
     */
    public static Number subtract(Number v, Number w)
            throws IllegalArgumentException {
        if (isFloat(v) || isFloat(w)) {
            return toDouble(v) - toDouble(w);
        } else if (v instanceof BigInteger || w instanceof BigInteger) {
            return toBig(v).subtract(toBig(w));
        } else {
            return longSubtract(toLong(v), toLong(w));
        }
    }

    /**
     * Return {@code v * w}.
     *
     * @param v left operand
     * @param w right operand
     * @return the product
     * @throws IllegalArgumentException if an operand is not a supported
     *     kind of number
     */
    public static Number multiply(Number v, Number w)
            throws IllegalArgumentException {
        if (isFloat(v) || isFloat(w)) {
            return toDouble(v) * toDouble(w);
        } else if (v instanceof BigInteger || w instanceof BigInteger) {
            return toBig(v).multiply(toBig(w));
        } else {
            return longMultiply(toLong(v), toLong(w));
        }
    }

    /**
     * Return {@code -v}.
     *
     * @param v operand
     * @return the negative
     * @throws IllegalArgumentException if the operand is not a supported
     *     kind of number
     */
    public static Number negate(Number v) throws IllegalArgumentException {
        if (isFloat(v)) {
            return -toDouble(v);
        } else if (v instanceof BigInteger) {
            return ((BigInteger)v).negate();
        } else {
            long lv = toLong(v);
            return lv == Long.MIN_VALUE ? BigInteger.valueOf(lv).negate()
                    : Long.valueOf(-lv);
        }
    }

    private static Number longAdd(long v, long w) {
        // Compute naive result
        long r = v + w;
        // Detect potential carry into bit 64 by examining sign bits
        if (((v ^ w) & BIT63) != 0L) {
            // Signs were opposite: result must be in range of long
            return r;
        } else if (((v ^ r) & BIT63) == 0L) {
            // Sign of result is same as sign of (both) operands
            return r;
        } else {
            return wrapped(r);
        }
    }

    private static Number longSubtract(long v, long w) {
        long r = v - w;
        if (((v ^ w) & BIT63) == 0L) {
            // Signs were the same: result must be in range of long
            return r;
        } else if (((v ^ r) & BIT63) == 0L) {
            // Sign of result is same as first operand: r is correct
            return r;
        } else {
            return wrapped(r);
        }
    }

    private static Number longMultiply(long v, long w) {
        long r = v * w;
        long high = Math.multiplyHigh(v, w);
        // Exact iff the high word is just the sign extension of r
        if (high == (r >> 63)) {
            return r;
        } else {
            return BigInteger.valueOf(v).multiply(BigInteger.valueOf(w));
        }
    }

    /** Correct a result that is wrong by 2**64 (carry lost). */
    private static BigInteger wrapped(long r) {
        BigInteger big = BigInteger.valueOf(r);
        // A negative r is too small by 2**64, a positive one too large.
        return r < 0L ? big.add(BIG_2_64) : big.subtract(BIG_2_64);
    }

    private static boolean isFloat(Number v) {
        return v instanceof Double || v instanceof Float;
    }

    private static double toDouble(Number v) {
        if (isFloat(v) || isIntegral(v) || v instanceof BigInteger) {
            return v.doubleValue();
        }
        throw unsupported(v);
    }

    private static boolean isIntegral(Number v) {
        return v instanceof Long || v instanceof Integer
                || v instanceof Short || v instanceof Byte;
    }

    private static long toLong(Number v) {
        if (isIntegral(v)) { return v.longValue(); }
        throw unsupported(v);
    }

    private static BigInteger toBig(Number v) {
        if (v instanceof BigInteger) {
            return (BigInteger)v;
        } else {
            return BigInteger.valueOf(toLong(v));
        }
    }

    private static IllegalArgumentException unsupported(Number v) {
        return new IllegalArgumentException(
                String.format("unsupported operand type %s",
                        v.getClass().getSimpleName()));
    }
}
