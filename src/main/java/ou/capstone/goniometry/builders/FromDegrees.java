package ou.capstone.goniometry.builders;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;
import ou.capstone.goniometry.exceptions.AngleOverflowException;
import ou.capstone.goniometry.util.Precision;

/**
 * Builds an angle from separate degrees, minutes, seconds and direction values.
 *
 * Magnitudes are taken as absolute values (the sign belongs to the direction) and seconds are
 * rounded to one decimal place. A null angle is always counterclockwise.
 */
public class FromDegrees extends AngleBuilder {
    private static final Logger logger = LoggerFactory.getLogger(FromDegrees.class);

    private final long rawDegrees;
    private final long rawMinutes;

    public FromDegrees(final int degrees, final int minutes, final double seconds) {
        this(degrees, minutes, seconds, Direction.COUNTER_CLOCKWISE);
    }

    /**
     * @param direction any negative value means clockwise, anything else counterclockwise
     */
    public FromDegrees(final int degrees, final int minutes, final double seconds, final int direction) {
        this(degrees, minutes, seconds, Direction.of(direction));
    }

    /**
     * @throws AngleOverflowException when degrees > 360, minutes > 59 or seconds > 59.9
     * @throws IllegalArgumentException when seconds is not a finite number
     */
    public FromDegrees(final int degrees, final int minutes, final double seconds, final Direction direction) {
        // widened so that Integer.MIN_VALUE keeps a positive magnitude
        this.rawDegrees = Math.abs((long) degrees);
        this.rawMinutes = Math.abs((long) minutes);
        this.seconds = Precision.round(Math.abs(seconds), 1);
        this.direction = Objects.requireNonNull(direction, "direction");
        checkOverflow();
        this.degrees = (int) rawDegrees;
        this.minutes = (int) rawMinutes;
        if (this.degrees == 0 && this.minutes == 0 && this.seconds == 0) {
            this.direction = Direction.COUNTER_CLOCKWISE;
        }
    }

    @Override
    protected void checkOverflow() {
        if (rawDegrees > Angle.MAX_DEGREES) {
            logger.debug("Rejecting degrees {}", rawDegrees);
            throw new AngleOverflowException("degrees", rawDegrees, Angle.MAX_DEGREES + "°");
        }
        if (rawMinutes >= Angle.MAX_MINUTES) {
            logger.debug("Rejecting minutes {}", rawMinutes);
            throw new AngleOverflowException("minutes", rawMinutes, (Angle.MAX_MINUTES - 1) + "'");
        }
        if (seconds >= Angle.MAX_SECONDS) {
            logger.debug("Rejecting seconds {}", seconds);
            throw new AngleOverflowException("seconds", seconds, "59.9\"");
        }
        if (rawDegrees == Angle.MAX_DEGREES && (rawMinutes > 0 || seconds > 0)) {
            throw new AngleOverflowException("magnitude",
                    rawDegrees + "° " + rawMinutes + "' " + seconds + "\"", Angle.MAX_DEGREES + "°");
        }
    }

    @Override
    protected AngleData calcData() {
        return AngleData.of(degrees, minutes, seconds, direction);
    }
}
