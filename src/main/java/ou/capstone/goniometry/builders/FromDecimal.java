package ou.capstone.goniometry.builders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;
import ou.capstone.goniometry.exceptions.AngleOverflowException;
import ou.capstone.goniometry.util.Precision;

/**
 * Builds an angle from decimal degrees, e.g. 12.5 for 12° 30' 0".
 *
 * The decimal passed in is kept as the angle's original decimal, so {@code toDecimal()} gives it
 * back unchanged. Seconds are derived with six more digits than the input carries, capped at
 * {@link Precision#MAX_FLOAT_DIGITS}.
 */
public class FromDecimal extends AngleBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FromDecimal.class);

    private final double decimal;
    private final int decimalPrecision;
    private final int secondsPrecision;

    /**
     * @param decimal decimal degrees in [-360, 360]
     * @throws AngleOverflowException when |decimal| > 360
     * @throws IllegalArgumentException when decimal is NaN or infinite
     */
    public FromDecimal(final double decimal) {
        this.decimal = decimal;
        checkOverflow();
        this.decimalPrecision = Precision.clampPrecision(Precision.countDecimalPlaces(decimal));
        this.secondsPrecision = Precision.clampPrecision(decimalPrecision + 6);
    }

    @Override
    protected void checkOverflow() {
        if (Double.isNaN(decimal) || Double.isInfinite(decimal)) {
            throw new IllegalArgumentException("Decimal degrees must be a finite number, got: " + decimal);
        }
        if (Math.abs(decimal) > Angle.MAX_DEGREES) {
            logger.debug("Rejecting decimal {}", decimal);
            throw new AngleOverflowException("decimal", decimal, "±" + Angle.MAX_DEGREES + "°");
        }
    }

    @Override
    protected AngleData calcData() {
        final SexagesimalParts parts = SexagesimalParts.fromDecimal(Math.abs(decimal), secondsPrecision);
        degrees = parts.degrees();
        minutes = parts.minutes();
        seconds = parts.seconds();
        direction = Direction.of(decimal);
        return new AngleData(degrees, minutes, seconds, direction,
                decimalPrecision, // suggested decimal precision
                decimal,
                secondsPrecision,
                null, null);
    }
}
