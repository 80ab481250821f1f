package ou.capstone.goniometry.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding helpers shared by the builders and the angle conversions.
 *
 * All rounding is half away from zero (0.5 becomes 1, -0.5 becomes -1), which is what
 * {@link RoundingMode#HALF_UP} does on a {@link BigDecimal}. Values go through
 * {@link BigDecimal#valueOf(double)} so that the decimal a caller typed (e.g. 2.675) is the one
 * being rounded, not its binary neighbour.
 */
public final class Precision {

    /** Maximum meaningful decimal digits of a 64-bit double. */
    public static final int MAX_FLOAT_DIGITS = 15;

    private Precision() {
        // Utility class - prevent instantiation
    }

    /**
     * Rounds a value to the given number of decimal places, ties away from zero.
     *
     * @param value  the value to round
     * @param digits number of decimal places (negative values round to tens, hundreds, ...)
     * @return the rounded value
     * @throws IllegalArgumentException if value is NaN or infinite
     */
    public static double round(final double value, final int digits) {
        requireFinite(value);
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Counts the decimal places a value actually carries, i.e. the smallest N >= 0 for which
     * rounding the value to N digits gives the value back.
     *
     * @param value the value to inspect
     * @return number of decimal places, never negative
     * @throws IllegalArgumentException if value is NaN or infinite
     */
    public static int countDecimalPlaces(final double value) {
        requireFinite(value);
        final BigDecimal stripped = BigDecimal.valueOf(value).stripTrailingZeros();
        return Math.max(0, stripped.scale());
    }

    /**
     * Clamps a requested precision to what a double can represent.
     *
     * @param requested requested number of decimal digits; the sign is ignored
     * @return {@code min(|requested|, MAX_FLOAT_DIGITS)}
     */
    public static int clampPrecision(final int requested) {
        return (int) Math.min(Math.abs((long) requested), MAX_FLOAT_DIGITS);
    }

    private static void requireFinite(final double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Value must be a finite number, got: " + value);
        }
    }
}
