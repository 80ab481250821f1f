package ou.capstone.goniometry.exceptions;

/**
 * Thrown when the regular expression engine itself fails while parsing an angle string.
 * This signals an engine malfunction, not a badly formatted input (see {@link NoMatchException}).
 */
public class RegExFailureException extends AngleException {

    public RegExFailureException(final String msg) {
        super(msg);
    }

    public RegExFailureException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
