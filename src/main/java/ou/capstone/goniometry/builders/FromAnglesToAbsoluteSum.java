package ou.capstone.goniometry.builders;

import java.util.Optional;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;

/**
 * Sums two angles as total rotation traveled: both addends count with their magnitude,
 * whatever their direction, and the result is always counterclockwise.
 * E.g. 1° + (-180°) = 181°.
 */
public class FromAnglesToAbsoluteSum extends SumBuilder {

    public FromAnglesToAbsoluteSum(final Angle firstAngle, final Angle secondAngle) {
        super(firstAngle, secondAngle);
    }

    @Override
    protected double combine(final double firstDecimal, final double secondDecimal) {
        return Math.abs(firstDecimal) + Math.abs(secondDecimal);
    }

    @Override
    protected Direction calcSign(final double sum) {
        return Direction.COUNTER_CLOCKWISE;
    }

    @Override
    protected Optional<AngleData> shortcut() {
        if (bothAnglesAreFullAngles()) {
            return Optional.of(fullAngle(Direction.COUNTER_CLOCKWISE));
        }
        if (bothAnglesAreNullAngles()) {
            return Optional.of(nullAngle());
        }
        return Optional.empty();
    }
}
