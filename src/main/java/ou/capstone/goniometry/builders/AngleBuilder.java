package ou.capstone.goniometry.builders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;

/**
 * Builds the canonical data of one angle from one kind of input.
 *
 * A builder validates its input when constructed ({@link #checkOverflow()}) and computes the
 * angle once in {@link #fetchData()}. Builders are single-use: a second fetch is rejected.
 */
public abstract class AngleBuilder {
    private static final Logger logger = LoggerFactory.getLogger(AngleBuilder.class);

    protected int degrees;
    protected int minutes;
    protected double seconds;
    protected Direction direction = Direction.COUNTER_CLOCKWISE;

    private boolean fetched;

    /**
     * Validates the builder input.
     *
     * @throws ou.capstone.goniometry.exceptions.AngleOverflowException if a value is out of range
     */
    protected abstract void checkOverflow();

    /**
     * Computes degrees, minutes, seconds, direction and provenance of the angle.
     */
    protected abstract AngleData calcData();

    /**
     * Fetches the data used to construct an angle.
     *
     * @return the canonical angle tuple
     * @throws IllegalStateException if this builder has already produced its angle
     */
    public AngleData fetchData() {
        if (fetched) {
            throw new IllegalStateException(getClass().getSimpleName() + " has already been used to build an angle");
        }
        fetched = true;
        final AngleData data = calcData();
        logger.debug("{} produced {}", getClass().getSimpleName(), data);
        return data;
    }
}
