package ou.capstone.goniometry.exceptions;

/**
 * Thrown when a string does not contain a recognizable degrees token, for example "abc" or "12'".
 */
public class NoMatchException extends AngleException {

    private final String angle;

    public NoMatchException(final String angle) {
        super(angle + " does not match an angle measure.");
        this.angle = angle;
    }

    /** @return the string that could not be parsed */
    public String getAngle() {
        return angle;
    }
}
