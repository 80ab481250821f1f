package ou.capstone.goniometry.operations;

import ou.capstone.goniometry.Angle;
import ou.capstone.goniometry.builders.SumBuilder;

/**
 * An angle obtained by adding two angles.
 *
 * @see ou.capstone.goniometry.builders.FromAnglesToRelativeSum
 * @see ou.capstone.goniometry.builders.FromAnglesToAbsoluteSum
 */
public class Sum extends Angle {

    public Sum(final SumBuilder builder) {
        super(builder);
    }
}
