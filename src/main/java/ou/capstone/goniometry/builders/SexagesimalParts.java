package ou.capstone.goniometry.builders;

import java.math.BigDecimal;
import java.math.RoundingMode;

import ou.capstone.goniometry.Angle;

/**
 * Degrees, minutes and seconds split out of a decimal magnitude.
 */
record SexagesimalParts(int degrees, int minutes, double seconds) {

    private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

    /**
     * Splits a non-negative decimal into degrees, minutes and seconds by truncating the integer
     * part and multiplying the remainder by 60, twice. The remainder is carried in decimal
     * arithmetic, so 12.504305 splits into exactly 12° 30' 15.498". Seconds rounded up to 60
     * carry into the minutes, and 60 minutes carry into the degrees.
     *
     * @param magnitude        decimal degrees, 0..360
     * @param secondsPrecision decimal places kept on the seconds
     */
    static SexagesimalParts fromDecimal(final double magnitude, final int secondsPrecision) {
        final BigDecimal value = BigDecimal.valueOf(magnitude);
        int degrees = value.intValue();
        BigDecimal remainder = value.subtract(BigDecimal.valueOf(degrees)).multiply(SIXTY);
        int minutes = remainder.intValue();
        remainder = remainder.subtract(BigDecimal.valueOf(minutes)).multiply(SIXTY);
        BigDecimal seconds = remainder.setScale(secondsPrecision, RoundingMode.HALF_UP);

        if (seconds.compareTo(SIXTY) >= 0) {
            seconds = seconds.subtract(SIXTY);
            minutes++;
        }
        if (minutes >= Angle.MAX_MINUTES) {
            minutes -= Angle.MAX_MINUTES;
            degrees++;
        }
        return new SexagesimalParts(degrees, minutes, seconds.doubleValue());
    }
}
