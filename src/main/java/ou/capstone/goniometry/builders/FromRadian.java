package ou.capstone.goniometry.builders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.exceptions.AngleOverflowException;
import ou.capstone.goniometry.util.Precision;

/**
 * Builds an angle from a radian value.
 *
 * The radian is converted to decimal degrees and handed to {@link FromDecimal}; the original
 * radian is then attached so {@code toRadian()} returns it without a double conversion.
 */
public class FromRadian extends AngleBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FromRadian.class);

    private final double radian;
    private final int radianPrecision;

    /**
     * @param radian radian value in [-2π, 2π]
     * @throws AngleOverflowException when |radian| > 2π
     * @throws IllegalArgumentException when radian is NaN or infinite
     */
    public FromRadian(final double radian) {
        this.radian = radian;
        checkOverflow();
        this.radianPrecision = Precision.clampPrecision(Precision.countDecimalPlaces(radian));
    }

    @Override
    protected void checkOverflow() {
        if (Double.isNaN(radian) || Double.isInfinite(radian)) {
            throw new IllegalArgumentException("Radian must be a finite number, got: " + radian);
        }
        if (Math.abs(radian) > Angle.MAX_RADIAN) {
            logger.debug("Rejecting radian {}", radian);
            throw new AngleOverflowException("radian", radian, "±2π");
        }
    }

    @Override
    protected AngleData calcData() {
        // 2π may convert to a hair above 360
        final double decimal = Math.max(-Angle.MAX_DEGREES,
                Math.min(Angle.MAX_DEGREES, Math.toDegrees(radian)));
        final AngleData data = new FromDecimal(decimal).fetchData();
        degrees = data.degrees();
        minutes = data.minutes();
        seconds = data.seconds();
        direction = data.direction();
        return data.withRadian(radian, radianPrecision);
    }
}
