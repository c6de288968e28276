package com.balatro.jokers.effect;

/**
 * Arithmetic that pins to the type's bounds instead of wrapping.
 */
public final class SaturatingMath {

    private SaturatingMath() {
        // Utility class - prevent instantiation
    }

    public static int add(int a, int b) {
        return narrow((long) a + b);
    }

    public static long add(long a, long b) {
        long result = a + b;
        // overflow iff both operands have the sign opposite to the result
        if (((a ^ result) & (b ^ result)) < 0) {
            return a < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return result;
    }

    public static int narrow(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    /**
     * Convert a non-negative double to a long, saturating at {@link Long#MAX_VALUE}.
     * NaN and negative values become 0.
     */
    public static long toLong(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return 0;
        }
        if (value >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return (long) Math.floor(value);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
