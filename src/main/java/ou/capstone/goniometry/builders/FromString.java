package ou.capstone.goniometry.builders;

import java.util.Objects;

import ou.capstone.goniometry.AngleData;
import ou.capstone.goniometry.Direction;
import ou.capstone.goniometry.parse.AngleStringParser;
import ou.capstone.goniometry.parse.ParsedAngle;

/**
 * Builds an angle from its textual representation, e.g. {@code -12° 30' 15.5"}.
 *
 * @see AngleStringParser
 */
public class FromString extends AngleBuilder {

    private final String measure;
    private final ParsedAngle parsed;

    /**
     * @param measure the angle text
     * @throws ou.capstone.goniometry.exceptions.NoMatchException       when no degrees token is found
     * @throws ou.capstone.goniometry.exceptions.AngleOverflowException when a field is out of range
     * @throws ou.capstone.goniometry.exceptions.RegExFailureException  when the regex engine fails
     */
    public FromString(final String measure) {
        this.measure = Objects.requireNonNull(measure, "measure");
        this.parsed = AngleStringParser.parse(measure);
        checkOverflow();
    }

    @Override
    protected void checkOverflow() {
        AngleStringParser.validate(parsed);
    }

    @Override
    protected AngleData calcData() {
        degrees = parsed.degrees();
        minutes = parsed.minutes();
        seconds = parsed.seconds();
        direction = parsed.negative() ? Direction.CLOCKWISE : Direction.COUNTER_CLOCKWISE;
        return AngleData.of(degrees, minutes, seconds, direction);
    }

    /** @return the text this builder was created with */
    public String getMeasure() {
        return measure;
    }
}
