package ou.capstone.goniometry.builders;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;
import ou.capstone.goniometry.util.Precision;

/**
 * Builds the sum of two angles.
 *
 * Both addends are converted to decimal with the higher of their suggested precisions, combined
 * by {@link #combine(double, double)}, rounded to that precision and split back into degrees,
 * minutes and seconds. A magnitude above 360° is reduced by 360° once; since each addend is
 * bounded to ±360°, one pass is always enough.
 */
public abstract class SumBuilder extends AngleBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SumBuilder.class);

    protected final Angle firstAngle;
    protected final Angle secondAngle;

    /** Decimal digits used for the addition. */
    protected int decimalPrecision;

    /** Signed decimal result after the overflow correction. */
    protected double decimalSum;

    protected SumBuilder(final Angle firstAngle, final Angle secondAngle) {
        this.firstAngle = firstAngle;
        this.secondAngle = secondAngle;
        checkOverflow();
    }

    /**
     * The addends are angles that already passed their own validation; only their presence
     * is checked here. Excess over 360° in the result is corrected, not rejected.
     */
    @Override
    protected void checkOverflow() {
        Objects.requireNonNull(firstAngle, "firstAngle");
        Objects.requireNonNull(secondAngle, "secondAngle");
    }

    /**
     * Combines the decimal values of the two addends.
     */
    protected abstract double combine(double firstDecimal, double secondDecimal);

    /**
     * Direction of the result given the combined decimal.
     */
    protected abstract Direction calcSign(double sum);

    /**
     * Result that needs no arithmetic, if any.
     */
    protected abstract Optional<AngleData> shortcut();

    @Override
    protected AngleData calcData() {
        final Optional<AngleData> shortcut = shortcut();
        if (shortcut.isPresent()) {
            logger.debug("Shortcut sum of {} and {}", firstAngle, secondAngle);
            return shortcut.get();
        }

        decimalPrecision = getMaxSuggestedDecimalPrecisionBetween(firstAngle, secondAngle);
        final double sum = Precision.round(
                combine(firstAngle.toDecimal(decimalPrecision), secondAngle.toDecimal(decimalPrecision)),
                decimalPrecision);
        direction = calcSign(sum);
        final double magnitude = correctOverflow(Math.abs(sum));
        decimalSum = direction.sign() * magnitude;

        final SexagesimalParts parts = SexagesimalParts.fromDecimal(magnitude,
                Precision.clampPrecision(decimalPrecision + 6));
        degrees = parts.degrees();
        minutes = parts.minutes();
        seconds = parts.seconds();
        logger.debug("Sum of {} and {} is {} at precision {}", firstAngle, secondAngle, decimalSum, decimalPrecision);

        return new AngleData(degrees, minutes, seconds, direction,
                decimalPrecision, // suggested decimal precision
                decimalSum,
                null, // seconds precision follows the resulting seconds
                null, null);
    }

    /**
     * Removes one full turn from a magnitude above 360°.
     */
    protected double correctOverflow(final double magnitude) {
        if (magnitude > Angle.MAX_DEGREES) {
            return Precision.round(magnitude - Angle.MAX_DEGREES, decimalPrecision);
        }
        return magnitude;
    }

    protected static int getMaxSuggestedDecimalPrecisionBetween(final Angle first, final Angle second) {
        return Math.max(first.suggestedDecimalPrecision(), second.suggestedDecimalPrecision());
    }

    protected boolean bothAnglesAreFullPositiveAngles() {
        return firstAngle.isFullAngle() && firstAngle.isCounterClockwise()
                && secondAngle.isFullAngle() && secondAngle.isCounterClockwise();
    }

    protected boolean bothAnglesAreFullNegativeAngles() {
        return firstAngle.isFullAngle() && firstAngle.isClockwise()
                && secondAngle.isFullAngle() && secondAngle.isClockwise();
    }

    protected boolean bothAnglesAreFullAngles() {
        return firstAngle.isFullAngle() && secondAngle.isFullAngle();
    }

    protected boolean bothAnglesAreNullAngles() {
        return firstAngle.isNullAngle() && secondAngle.isNullAngle();
    }

    protected static AngleData fullAngle(final Direction direction) {
        return AngleData.of(Angle.MAX_DEGREES, 0, 0.0, direction);
    }

    protected static AngleData nullAngle() {
        return AngleData.of(0, 0, 0.0, Direction.COUNTER_CLOCKWISE);
    }
}
