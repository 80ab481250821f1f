package ou.capstone.goniometry;

import java.util.Objects;

import ou.capstone.goniometry.util.Precision;

/**
 * Canonical angle tuple produced by a builder and consumed by {@link Angle}.
 *
 * Nullable provenance fields are filled in here when a builder leaves them out:
 * the seconds precision defaults to the decimal places of {@code seconds}, and the suggested
 * decimal precision to {@code min(secondsPrecision + 6, MAX_FLOAT_DIGITS)}.
 * A null angle (0° 0' 0") is always counterclockwise.
 *
 * @param degrees                   degrees magnitude, 0..360
 * @param minutes                   minutes, 0..59
 * @param seconds                   seconds, 0 (inclusive) to 60 (exclusive)
 * @param direction                 rotation direction
 * @param suggestedDecimalPrecision digits used by {@code toDecimal()} when none are requested
 * @param originalDecimal           decimal value the angle was built from, or null
 * @param secondsPrecision          decimal digits the seconds were specified/derived with
 * @param originalRadian            radian value the angle was built from, or null
 * @param originalRadianPrecision   decimal digits of {@code originalRadian}, or null
 */
public record AngleData(int degrees, int minutes, double seconds, Direction direction,
                        Integer suggestedDecimalPrecision, Double originalDecimal,
                        Integer secondsPrecision, Double originalRadian,
                        Integer originalRadianPrecision) {

    public AngleData {
        Objects.requireNonNull(direction, "direction");
        if (degrees < 0 || degrees > Angle.MAX_DEGREES
                || minutes < 0 || minutes >= Angle.MAX_MINUTES
                || seconds < 0 || seconds >= Angle.MAX_SECONDS
                || (degrees == Angle.MAX_DEGREES && (minutes > 0 || seconds > 0))) {
            throw new IllegalArgumentException(String.format(
                    "Not a canonical angle: %d° %d' %s\"", degrees, minutes, seconds));
        }
        if (degrees == 0 && minutes == 0 && seconds == 0) {
            direction = Direction.COUNTER_CLOCKWISE;
        }
        if (secondsPrecision == null) {
            secondsPrecision = Precision.countDecimalPlaces(seconds);
        }
        if (suggestedDecimalPrecision == null) {
            suggestedDecimalPrecision = Precision.clampPrecision(secondsPrecision + 6);
        }
    }

    /** Shorthand for a tuple that carries no provenance. */
    public static AngleData of(final int degrees, final int minutes, final double seconds,
                               final Direction direction) {
        return new AngleData(degrees, minutes, seconds, direction, null, null, null, null, null);
    }

    /**
     * Same magnitude, opposite direction. Cached decimal and radian values flip sign with it.
     * A null angle has no opposite and is returned as is.
     */
    public AngleData toggled() {
        if (isNullAngle()) {
            return this;
        }
        return new AngleData(degrees, minutes, seconds, direction.opposite(),
                suggestedDecimalPrecision,
                originalDecimal == null ? null : -originalDecimal,
                secondsPrecision,
                originalRadian == null ? null : -originalRadian,
                originalRadianPrecision);
    }

    /**
     * Same tuple with a radian value attached.
     */
    public AngleData withRadian(final double radian, final int radianPrecision) {
        return new AngleData(degrees, minutes, seconds, direction, suggestedDecimalPrecision,
                originalDecimal, secondsPrecision, radian, radianPrecision);
    }

    public boolean isNullAngle() {
        return degrees == 0 && minutes == 0 && seconds == 0;
    }

    public boolean isFullAngle() {
        return degrees == Angle.MAX_DEGREES && minutes == 0 && seconds == 0;
    }
}
