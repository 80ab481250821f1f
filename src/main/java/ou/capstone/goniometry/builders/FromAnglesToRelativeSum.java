package ou.capstone.goniometry.builders;

import java.util.Optional;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;

/**
 * Sums two angles algebraically: the result keeps the sign of the net rotation.
 * E.g. 30° + (-90°) = -60°, and 300° + 100° = 40° after removing the full turn.
 */
public class FromAnglesToRelativeSum extends SumBuilder {

    public FromAnglesToRelativeSum(final Angle firstAngle, final Angle secondAngle) {
        super(firstAngle, secondAngle);
    }

    @Override
    protected double combine(final double firstDecimal, final double secondDecimal) {
        return firstDecimal + secondDecimal;
    }

    @Override
    protected Direction calcSign(final double sum) {
        return Direction.of(sum);
    }

    @Override
    protected Optional<AngleData> shortcut() {
        if (bothAnglesAreFullPositiveAngles()) {
            return Optional.of(fullAngle(Direction.COUNTER_CLOCKWISE));
        }
        if (bothAnglesAreFullNegativeAngles()) {
            return Optional.of(fullAngle(Direction.CLOCKWISE));
        }
        if (bothAnglesAreNullAngles()) {
            return Optional.of(nullAngle());
        }
        return Optional.empty();
    }
}
